package com.dcruver.litreview.domain;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The configured export directory is missing or is not a directory.
 * Distinct from a readable directory that simply yields no papers.
 */
public class SourceDirectoryUnavailableException extends IOException {

    private final Path directory;

    public SourceDirectoryUnavailableException(Path directory) {
        super("Source directory is not available: " + directory);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
