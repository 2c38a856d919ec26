package com.dcruver.litreview.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * One bibliographic record from a tagged export file.
 * Serialized flat with snake_case keys for the visualization front end.
 */
@Value
@Builder
@With
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "title", "year", "abstract", "authors", "doi", "unique_search_terms",
    "branch_tags", "content_locator", "source_collection", "journal", "volume", "issue", "pages",
    "url", "keywords"})
public class Paper {
    PaperId id;
    String title;
    Integer year;

    @JsonProperty("abstract")
    @Builder.Default
    String abstractText = "";

    @Singular
    List<String> authors;  // AU, order and duplicates preserved

    @Builder.Default
    String doi = "";

    @Singular
    List<String> uniqueSearchTerms;  // N1

    @Singular
    List<String> branchTags;  // RN, empty means uncategorized

    @Builder.Default
    String contentLocator = "";  // L1

    @Builder.Default
    String sourceCollection = "";

    @Builder.Default
    String journal = "";
    @Builder.Default
    String volume = "";
    @Builder.Default
    String issue = "";
    @Builder.Default
    String pages = "";
    @Builder.Default
    String url = "";

    @Singular
    List<String> keywords;

    @JsonIgnore
    public boolean isUncategorized() {
        return branchTags.isEmpty();
    }
}
