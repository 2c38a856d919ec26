package com.dcruver.litreview.graph;

import lombok.Value;

@Value
public class GraphEdge {

    public static final String SMOOTH_STEP = "smoothstep";

    String id;
    String source;
    String target;
    String type;

    public static GraphEdge between(GraphNode source, GraphNode target) {
        return new GraphEdge(source.getId() + "-" + target.getId(), source.getId(), target.getId(), SMOOTH_STEP);
    }
}
