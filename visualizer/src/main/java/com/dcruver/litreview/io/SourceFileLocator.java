package com.dcruver.litreview.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Picks the newest export file for a name prefix.
 */
@Component
@Slf4j
public class SourceFileLocator {

    /**
     * Find the most recently modified regular file in {@code directory} whose name starts with
     * {@code prefix} and ends with {@code extension}. Empty when the directory is absent or nothing matches.
     */
    public Optional<Path> findNewest(Path directory, String prefix, String extension) throws IOException {
        if (!Files.isDirectory(directory)) {
            log.debug("Directory does not exist: {}", directory);
            return Optional.empty();
        }

        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(extension);
                })
                .max(Comparator.comparing(SourceFileLocator::lastModified)
                    .thenComparing(p -> p.getFileName().toString()));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
