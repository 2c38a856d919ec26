package com.dcruver.litreview.io;

import java.util.Optional;

/**
 * Resolves a paper's content locator (for example {@code internal-pdf://123/paper.pdf})
 * to something a client can open. Implementations live outside this application.
 */
public interface ContentLocatorResolver {

    boolean isAvailable(String locator);

    Optional<String> resolve(String locator);
}
