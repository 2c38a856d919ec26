package com.dcruver.litreview.domain;

import lombok.Value;

import java.nio.file.Path;

/**
 * A named classification scope bound to the export file its papers come from.
 */
@Value
public class Query {
    String name;
    String queryString;
    Path sourceFile;

    /**
     * Text shown on the query node; the query name when no query string is configured
     */
    public String displayQuery() {
        return queryString != null && !queryString.isBlank() ? queryString : name;
    }
}
