package com.dcruver.litreview.domain;

import com.dcruver.litreview.io.ContentLocatorResolver;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Listing, search and lookup over the flat paper list of a library scan.
 */
@Component
public class PaperCatalog {

    /**
     * Papers whose title or abstract contains {@code search} (case-insensitive), in the given order.
     * A blank search keeps every paper.
     */
    public List<Paper> list(List<Paper> papers, String search, PaperSort sort) {
        String needle = search == null ? "" : search.toLowerCase(Locale.ROOT);
        return papers.stream()
            .filter(p -> needle.isEmpty()
                || p.getTitle().toLowerCase(Locale.ROOT).contains(needle)
                || p.getAbstractText().toLowerCase(Locale.ROOT).contains(needle))
            .sorted(sort.comparator())
            .toList();
    }

    /**
     * First paper whose identifier prints as {@code id}
     */
    public Optional<Paper> findById(List<Paper> papers, String id) {
        return papers.stream()
            .filter(p -> p.getId() != null && p.getId().toString().equals(id))
            .findFirst();
    }

    /**
     * Ask the resolver about a paper's content locator. The resolver may be null when none is configured.
     */
    public LocatorStatus locatorStatus(Paper paper, ContentLocatorResolver resolver) {
        String locator = paper.getContentLocator();
        if (locator == null || locator.isBlank()) {
            return LocatorStatus.missingLocator();
        }
        if (resolver == null) {
            return LocatorStatus.resolverUnavailable(locator);
        }
        boolean available = resolver.isAvailable(locator);
        String location = available ? resolver.resolve(locator).orElse(null) : null;
        return new LocatorStatus(available, locator, location, null);
    }
}
