package com.dcruver.litreview.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Overlays a curated record set onto an already built hierarchy.
 *
 * <p>Each curated record is matched against the parsed papers by normalized title or DOI, then
 * filed under whichever of its own tags currently has the fewest papers in the matched paper's query.
 * Equal counts go to the tag listed first on the curated record.
 *
 * <p>Matching is a linear scan of every parsed paper per curated record. An index keyed by
 * normalized title and DOI is the first thing to add if corpora grow well past tens of thousands.
 */
@Component
@Slf4j
public class CrossReferenceMatcher {

    /**
     * Build an overlay from curated records. Unmatched or unplaceable records contribute nothing.
     *
     * @param curated    records from a curated file, in file order
     * @param allPapers  every parsed paper, in encounter order
     * @param hierarchy  the base classification; read only
     */
    public Hierarchy overlay(List<Paper> curated, List<Paper> allPapers, Hierarchy hierarchy) {
        Hierarchy overlay = new Hierarchy();
        int matched = 0;
        int placed = 0;

        for (Paper item : curated) {
            Optional<Paper> match = findMatch(item, allPapers);
            if (match.isEmpty()) {
                continue;
            }
            matched++;

            Paper paper = match.get();
            Optional<QueryRef> query = hierarchy.findQueryContaining(paper);
            if (query.isEmpty()) {
                continue;
            }

            Optional<String> tag = leastPopulatedTag(item.getBranchTags(), query.get(), hierarchy);
            if (tag.isPresent()) {
                overlay.add(query.get().getCollection(), query.get().getQuery(), tag.get(), paper);
                placed++;
            }
        }

        log.info("Matched {} of {} curated records, placed {}", matched, curated.size(), placed);
        return overlay;
    }

    /**
     * First parsed paper whose normalized title or normalized DOI equals the curated record's
     */
    Optional<Paper> findMatch(Paper item, List<Paper> allPapers) {
        String title = normalize(item.getTitle());
        String doi = normalize(item.getDoi());

        for (Paper candidate : allPapers) {
            if (!title.isEmpty() && title.equals(normalize(candidate.getTitle()))) {
                return Optional.of(candidate);
            }
            if (!doi.isEmpty() && doi.equals(normalize(candidate.getDoi()))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Among the curated tags that resolve to a bucket of the query, the one with the fewest papers
     */
    Optional<String> leastPopulatedTag(List<String> curatedTags, QueryRef query, Hierarchy hierarchy) {
        String selected = null;
        int fewest = Integer.MAX_VALUE;

        for (String tag : curatedTags) {
            Optional<String> resolved = hierarchy.resolveTag(query, tag);
            if (resolved.isEmpty()) {
                continue;
            }
            int count = hierarchy.bucket(query.getCollection(), query.getQuery(), resolved.get()).size();
            if (count < fewest) {
                fewest = count;
                selected = resolved.get();
            }
        }
        return Optional.ofNullable(selected);
    }

    static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).strip();
    }
}
