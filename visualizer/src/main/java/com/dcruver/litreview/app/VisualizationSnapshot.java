package com.dcruver.litreview.app;

import com.dcruver.litreview.domain.LibraryState;
import com.dcruver.litreview.graph.VisualizationGraph;
import lombok.Value;

import java.time.Instant;

/**
 * A fully built library and its graph, as handed out by {@link VisualizationCache}.
 */
@Value
public class VisualizationSnapshot {
    LibraryState state;
    VisualizationGraph graph;
    Instant builtAt;
}
