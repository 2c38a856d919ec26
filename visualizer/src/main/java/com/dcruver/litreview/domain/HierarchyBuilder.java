package com.dcruver.litreview.domain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Files each query's papers into canonical tag buckets.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HierarchyBuilder {

    private final TermCanonicalizer canonicalizer;

    /**
     * Add one query's papers to the hierarchy.
     * A paper goes into one bucket per tag (no de-duplication); untagged papers go to {@link Hierarchy#UNCATEGORIZED}.
     */
    public void addQuery(Hierarchy hierarchy, String collection, String queryName, List<Paper> papers) {
        Map<String, String> table = canonicalizer.buildTable(papers);
        hierarchy.addQuery(collection, queryName);

        for (Paper paper : papers) {
            if (paper.isUncategorized()) {
                hierarchy.add(collection, queryName, Hierarchy.UNCATEGORIZED, paper);
                continue;
            }
            for (String tag : canonicalizer.canonicalize(paper.getBranchTags(), table)) {
                hierarchy.add(collection, queryName, tag, paper);
            }
        }

        log.debug("Query {} in {}: {} papers, {} canonical tags",
            queryName, collection, papers.size(), table.size());
    }
}
