package com.dcruver.litreview.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of one library scan: parsed papers, their classification and both curated overlays.
 */
@Value
@Builder
public class LibraryState {
    List<Query> queries;
    List<Paper> papers;  // every parsed paper, in encounter order, not de-duplicated
    Hierarchy hierarchy;
    Hierarchy highlights;
    Hierarchy relevance;

    public static LibraryState empty() {
        return LibraryState.builder()
            .queries(List.of())
            .papers(List.of())
            .hierarchy(new Hierarchy())
            .highlights(new Hierarchy())
            .relevance(new Hierarchy())
            .build();
    }

    public Optional<Query> findQuery(String name) {
        return queries.stream().filter(q -> q.getName().equals(name)).findFirst();
    }
}
