package com.dcruver.litreview.graph;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-type ordinals for node ids ({@code tag_1}, {@code tag_2}, ...). One instance per layout run.
 */
class NodeIdSequence {

    private final Map<NodeType, Integer> counters = new EnumMap<>(NodeType.class);

    String next(NodeType type) {
        int ordinal = counters.merge(type, 1, Integer::sum);
        return type.wireName() + "_" + ordinal;
    }
}
