package com.dcruver.litreview.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * Identifier of a parsed paper.
 * Numeric source identifiers keep their numeric form so they serialize as JSON numbers;
 * anything else (including the generated {@code paper_<n>} fallback) stays textual.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PaperId {

    private static final String FALLBACK_PREFIX = "paper_";

    private final Long number;
    private final String text;

    /**
     * Parse a raw identifier field value, preferring its integer form
     */
    public static PaperId parse(String raw) {
        String value = raw.trim();
        try {
            return new PaperId(Long.parseLong(value), null);
        } catch (NumberFormatException e) {
            return new PaperId(null, value);
        }
    }

    /**
     * Generated identifier for records that carry none
     */
    public static PaperId fallback(int ordinal) {
        return new PaperId(null, FALLBACK_PREFIX + ordinal);
    }

    public boolean isNumeric() {
        return number != null;
    }

    @JsonValue
    public Object value() {
        return number != null ? number : text;
    }

    @Override
    public String toString() {
        return number != null ? number.toString() : text;
    }
}
