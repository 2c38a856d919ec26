package com.dcruver.litreview.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of node in the visualization graph.
 */
public enum NodeType {
    COLLECTION("collection"),
    QUERY("query"),
    TAG("tag"),
    CURATED_HIGHLIGHT("curated-highlight"),
    UNCATEGORIZED("uncategorized"),
    AGGREGATE_HIGHLIGHT("aggregate-highlight"),
    AGGREGATE_RELEVANT("aggregate-relevant");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
