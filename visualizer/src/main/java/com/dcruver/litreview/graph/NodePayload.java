package com.dcruver.litreview.graph;

import com.dcruver.litreview.domain.Paper;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Data carried by a node. Only the label is always present.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodePayload {
    String label;
    String collection;
    String query;
    String queryName;
    String tag;
    List<Paper> papers;
    Integer paperCount;

    public static NodePayload withPapers(String label, List<Paper> papers) {
        return NodePayload.builder()
            .label(label)
            .papers(List.copyOf(papers))
            .paperCount(papers.size())
            .build();
    }
}
