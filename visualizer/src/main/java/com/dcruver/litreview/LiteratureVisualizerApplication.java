package com.dcruver.litreview;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Literature review visualizer.
 *
 * Reads tagged bibliographic exports, classifies papers by query and branch tag,
 * overlays the curated "most cited" and "most relevant" selections and lays the
 * result out as a graph for a flow-chart front end.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class LiteratureVisualizerApplication {

    public static void main(String[] args) {
        log.info("Starting Literature Review Visualizer...");
        SpringApplication.run(LiteratureVisualizerApplication.class, args);
    }
}
