package com.dcruver.litreview.app;

import com.dcruver.litreview.config.VisualizerProperties;
import com.dcruver.litreview.domain.LibraryScanner;
import com.dcruver.litreview.domain.LibraryState;
import com.dcruver.litreview.domain.LocatorStatus;
import com.dcruver.litreview.domain.Paper;
import com.dcruver.litreview.domain.PaperCatalog;
import com.dcruver.litreview.domain.PaperSort;
import com.dcruver.litreview.domain.Query;
import com.dcruver.litreview.domain.SourceDirectoryUnavailableException;
import com.dcruver.litreview.io.ContentLocatorResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Spring Shell commands exposing the hierarchy, the graph and the paper listing.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class VisualizerShellCommands {

    private final VisualizationCache cache;
    private final LibraryScanner scanner;
    private final PaperCatalog catalog;
    private final VisualizerProperties properties;
    private final ObjectProvider<ContentLocatorResolver> locatorResolver;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @ShellMethod(key = "load", value = "Parse export files and build the graph (cached)")
    public String load() {
        try {
            return summarize(cache.load());
        } catch (SourceDirectoryUnavailableException e) {
            log.error("Load failed", e);
            return "Source directory not available: " + e.getDirectory();
        } catch (Exception e) {
            log.error("Load failed", e);
            return "Load failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reload", value = "Discard the cached build and parse again")
    public String reload() {
        cache.invalidate();
        return load();
    }

    @ShellMethod(key = "summary", value = "Show counts for the current build")
    public String summary() {
        return cache.current()
            .map(this::summarize)
            .orElse("Nothing loaded yet. Run 'load' first.");
    }

    @ShellMethod(key = "queries", value = "Show configured queries and the export files they resolve to")
    public String queries() {
        try {
            Path sourceDir = Path.of(properties.getSourceDir()).toAbsolutePath().normalize();
            if (!Files.isDirectory(sourceDir)) {
                return "Source directory not available: " + sourceDir;
            }

            List<Query> resolved = scanner.resolveQueries(sourceDir);
            StringBuilder result = new StringBuilder();
            result.append(String.format("Source directory: %s\n", sourceDir));
            properties.getQueries().forEach((name, source) -> {
                Optional<Query> query = resolved.stream().filter(q -> q.getName().equals(name)).findFirst();
                result.append(String.format("- %s (prefix '%s'): %s\n", name, source.getPrefix(),
                    query.map(q -> q.getSourceFile().getFileName().toString()).orElse("no file found")));
            });
            return result.toString();
        } catch (Exception e) {
            log.error("Failed to resolve queries", e);
            return "Failed to resolve queries: " + e.getMessage();
        }
    }

    @ShellMethod(key = "hierarchy", value = "Print the collection/query/tag hierarchy as JSON")
    public String hierarchy(@ShellOption(defaultValue = ShellOption.NULL) String output) {
        try {
            return writeJson(cache.load().getState().getHierarchy(), output);
        } catch (Exception e) {
            log.error("Failed to export hierarchy", e);
            return "Failed to export hierarchy: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph", value = "Print the positioned graph as JSON")
    public String graph(@ShellOption(defaultValue = ShellOption.NULL) String output) {
        try {
            return writeJson(cache.load().getGraph(), output);
        } catch (Exception e) {
            log.error("Failed to export graph", e);
            return "Failed to export graph: " + e.getMessage();
        }
    }

    @ShellMethod(key = "papers", value = "List parsed papers, optionally filtered and sorted")
    public String papers(
            @ShellOption(defaultValue = "") String search,
            @ShellOption(defaultValue = "year") String sort,
            @ShellOption(defaultValue = "50") int limit) {
        try {
            List<Paper> papers = catalog.list(cache.load().getState().getPapers(), search, PaperSort.fromName(sort));
            if (papers.isEmpty()) {
                return "No papers found.";
            }

            StringBuilder result = new StringBuilder();
            result.append(String.format("%d papers", papers.size()));
            if (papers.size() > limit) {
                result.append(String.format(" (showing %d)", limit));
            }
            result.append("\n\n");

            for (Paper paper : papers.stream().limit(limit).toList()) {
                result.append(String.format("[%s] %s (%s)\n", paper.getId(), paper.getTitle(),
                    paper.getYear() != null ? paper.getYear() : "n.d."));
            }
            return result.toString();
        } catch (Exception e) {
            log.error("Failed to list papers", e);
            return "Failed to list papers: " + e.getMessage();
        }
    }

    @ShellMethod(key = "locator", value = "Check whether a paper's content is available")
    public String locator(@ShellOption String id) {
        try {
            LibraryState state = cache.load().getState();
            Optional<Paper> paper = catalog.findById(state.getPapers(), id);
            if (paper.isEmpty()) {
                return "Paper not found: " + id;
            }

            LocatorStatus status = catalog.locatorStatus(paper.get(), locatorResolver.getIfAvailable());
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
        } catch (Exception e) {
            log.error("Locator check failed", e);
            return "Locator check failed: " + e.getMessage();
        }
    }

    private String writeJson(Object value, String output) throws Exception {
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        if (output == null) {
            return json;
        }
        Path target = Path.of(output);
        Files.writeString(target, json);
        log.info("Wrote {}", target);
        return "Wrote " + target.toAbsolutePath();
    }

    private String summarize(VisualizationSnapshot snapshot) {
        LibraryState state = snapshot.getState();
        StringBuilder result = new StringBuilder();
        result.append(String.format("Built at %s\n\n", snapshot.getBuiltAt()));
        result.append(String.format("- Queries: %d\n", state.getQueries().size()));
        result.append(String.format("- Papers: %d\n", state.getPapers().size()));
        result.append(String.format("- Collections: %s\n", state.getHierarchy().collections()));
        result.append(String.format("- Highlighted placements: %d\n", state.getHighlights().paperCount()));
        result.append(String.format("- Relevance placements: %d\n", state.getRelevance().paperCount()));
        result.append(String.format("- Graph: %d nodes, %d edges\n",
            snapshot.getGraph().getNodes().size(), snapshot.getGraph().getEdges().size()));
        if (state.getPapers().isEmpty()) {
            result.append("\nNo papers found. Check the query prefixes with 'queries'.\n");
        }
        return result.toString();
    }
}
