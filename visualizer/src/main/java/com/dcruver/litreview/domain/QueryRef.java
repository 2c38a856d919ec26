package com.dcruver.litreview.domain;

import lombok.Value;

/**
 * Position of a query inside a {@link Hierarchy}.
 */
@Value
public class QueryRef {
    String collection;
    String query;
}
