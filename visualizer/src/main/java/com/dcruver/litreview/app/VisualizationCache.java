package com.dcruver.litreview.app;

import com.dcruver.litreview.domain.LibraryScanner;
import com.dcruver.litreview.domain.LibraryState;
import com.dcruver.litreview.graph.GraphLayoutEngine;
import com.dcruver.litreview.graph.VisualizationGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Holds the last built snapshot so repeated requests do not re-parse the export files.
 * Building is delegated to the stateless scanner and layout engine.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VisualizationCache {

    private final LibraryScanner scanner;
    private final GraphLayoutEngine layoutEngine;

    private VisualizationSnapshot snapshot;

    /**
     * Return the cached snapshot, building it first if needed
     */
    public synchronized VisualizationSnapshot load() throws IOException {
        if (snapshot == null) {
            snapshot = build();
        }
        return snapshot;
    }

    /**
     * Drop the cached snapshot; the next {@link #load()} rebuilds
     */
    public synchronized void invalidate() {
        if (snapshot != null) {
            log.info("Invalidated visualization snapshot built at {}", snapshot.getBuiltAt());
        }
        snapshot = null;
    }

    public synchronized VisualizationSnapshot reload() throws IOException {
        invalidate();
        return load();
    }

    public synchronized Optional<VisualizationSnapshot> current() {
        return Optional.ofNullable(snapshot);
    }

    private VisualizationSnapshot build() throws IOException {
        LibraryState state = scanner.scan();
        VisualizationGraph graph = layoutEngine.layout(state);
        log.info("Built visualization: {} papers, {} nodes, {} edges",
            state.getPapers().size(), graph.getNodes().size(), graph.getEdges().size());
        return new VisualizationSnapshot(state, graph, Instant.now());
    }
}
