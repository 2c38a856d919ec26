package com.dcruver.litreview.graph;

import lombok.Value;

@Value
public class GraphNode {
    String id;
    NodeType type;
    Position position;
    NodePayload data;
}
