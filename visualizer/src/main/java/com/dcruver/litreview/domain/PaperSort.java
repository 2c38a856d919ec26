package com.dcruver.litreview.domain;

import java.util.Comparator;
import java.util.Locale;

/**
 * Orderings offered by the paper listing.
 */
public enum PaperSort {
    /**
     * Newest first; papers without a year sort as year 0. Equal years by title, descending.
     */
    YEAR(Comparator.<Paper>comparingInt(p -> p.getYear() != null ? p.getYear() : 0)
        .thenComparing(Paper::getTitle)
        .reversed()),

    /**
     * Case-insensitive title, ascending
     */
    TITLE(Comparator.comparing((Paper p) -> p.getTitle().toLowerCase(Locale.ROOT)));

    private final Comparator<Paper> comparator;

    PaperSort(Comparator<Paper> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Paper> comparator() {
        return comparator;
    }

    public static PaperSort fromName(String name) {
        return name != null && name.equalsIgnoreCase("title") ? TITLE : YEAR;
    }
}
