package com.dcruver.litreview.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Availability of a paper's content, as reported by a content locator resolver.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocatorStatus {
    boolean available;
    String locator;
    String location;
    String error;

    public static LocatorStatus missingLocator() {
        return new LocatorStatus(false, null, null, "No content locator in record");
    }

    public static LocatorStatus resolverUnavailable(String locator) {
        return new LocatorStatus(false, locator, null, "No content locator resolver configured");
    }
}
