package com.dcruver.litreview.domain;

import com.dcruver.litreview.config.VisualizerProperties;
import com.dcruver.litreview.io.RisFileReader;
import com.dcruver.litreview.io.SourceFileLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs parse → canonicalize → group → curated match for every configured query.
 * Holds no state between scans.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LibraryScanner {

    private final VisualizerProperties properties;
    private final SourceFileLocator fileLocator;
    private final RisFileReader fileReader;
    private final HierarchyBuilder hierarchyBuilder;
    private final CrossReferenceMatcher matcher;

    /**
     * Scan the configured source directory.
     *
     * @throws SourceDirectoryUnavailableException if the source directory itself is missing
     * @throws IOException if a resolved export or curated file cannot be read
     */
    public LibraryState scan() throws IOException {
        Path sourceDir = Path.of(properties.getSourceDir()).toAbsolutePath().normalize();
        if (!Files.isDirectory(sourceDir)) {
            log.error("Source directory is not available: {}", sourceDir);
            throw new SourceDirectoryUnavailableException(sourceDir);
        }

        log.info("Scanning export files in: {}", sourceDir);

        List<Query> queries = resolveQueries(sourceDir);
        List<Paper> allPapers = new ArrayList<>();
        Hierarchy hierarchy = new Hierarchy();

        for (Query query : queries) {
            List<Paper> papers = fileReader.read(query.getSourceFile());
            String collection = RisFileReader.collectionName(query.getSourceFile());
            hierarchyBuilder.addQuery(hierarchy, collection, query.getName(), papers);
            allPapers.addAll(papers);
        }

        log.info("Parsed {} papers across {} queries", allPapers.size(), queries.size());

        Path curatedDir = Path.of(properties.getCuratedDir()).toAbsolutePath().normalize();
        if (!Files.isDirectory(curatedDir)) {
            log.warn("Curated directory does not exist, highlight and relevance overlays are empty: {}", curatedDir);
        }
        Hierarchy highlights = loadOverlay(curatedDir, properties.getHighlightPrefix(), allPapers, hierarchy);
        Hierarchy relevance = loadOverlay(curatedDir, properties.getRelevancePrefix(), allPapers, hierarchy);

        return LibraryState.builder()
            .queries(List.copyOf(queries))
            .papers(List.copyOf(allPapers))
            .hierarchy(hierarchy)
            .highlights(highlights)
            .relevance(relevance)
            .build();
    }

    /**
     * Bind each configured query to the newest export file for its prefix. Queries with no file are skipped.
     */
    public List<Query> resolveQueries(Path sourceDir) throws IOException {
        List<Query> resolved = new ArrayList<>();

        for (Map.Entry<String, VisualizerProperties.QuerySource> entry : properties.getQueries().entrySet()) {
            String name = entry.getKey();
            VisualizerProperties.QuerySource source = entry.getValue();

            if (source.getPrefix() == null || source.getPrefix().isBlank()) {
                log.warn("No file prefix configured for query '{}'", name);
                continue;
            }

            Optional<Path> file = fileLocator.findNewest(sourceDir, source.getPrefix(), properties.getFileExtension());
            if (file.isEmpty()) {
                log.warn("No export file found with prefix '{}' for query '{}'", source.getPrefix(), name);
                continue;
            }

            log.info("Query '{}' uses {}", name, file.get().getFileName());
            resolved.add(new Query(name, source.getQuery(), file.get()));
        }
        return resolved;
    }

    private Hierarchy loadOverlay(Path curatedDir, String prefix, List<Paper> allPapers, Hierarchy hierarchy)
            throws IOException {
        Optional<Path> file = fileLocator.findNewest(curatedDir, prefix, properties.getFileExtension());
        if (file.isEmpty()) {
            log.info("No {} file found in {}", prefix, curatedDir);
            return new Hierarchy();
        }

        List<Paper> curated = fileReader.read(file.get());
        log.info("Found {} records in {}", curated.size(), file.get().getFileName());
        return matcher.overlay(curated, allPapers, hierarchy);
    }
}
