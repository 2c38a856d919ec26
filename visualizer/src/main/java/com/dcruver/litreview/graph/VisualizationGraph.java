package com.dcruver.litreview.graph;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Positioned nodes and edges, serialized as {@code {nodes: [...], edges: [...]}}.
 */
@Value
public class VisualizationGraph {
    List<GraphNode> nodes;
    List<GraphEdge> edges;

    public static VisualizationGraph empty() {
        return new VisualizationGraph(List.of(), List.of());
    }

    public Optional<GraphNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public List<GraphNode> nodesOfType(NodeType type) {
        return nodes.stream().filter(n -> n.getType() == type).toList();
    }
}
