package com.dcruver.litreview.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where export and curated files live and which queries to build.
 */
@ConfigurationProperties(prefix = "visualizer")
@Data
public class VisualizerProperties {

    private String sourceDir = "RIS_source_files";

    /**
     * Curated override files; defaults to {@code <source-dir>/manual_groupings}
     */
    private String curatedDir;

    private String fileExtension = ".txt";
    private String highlightPrefix = "most_cited";
    private String relevancePrefix = "most_relevant";

    /**
     * Query name to query definition, in display order
     */
    private Map<String, QuerySource> queries = new LinkedHashMap<>();

    public String getCuratedDir() {
        return curatedDir != null && !curatedDir.isBlank() ? curatedDir : sourceDir + "/manual_groupings";
    }

    @Data
    public static class QuerySource {
        private String query;
        private String prefix;
    }
}
