package com.dcruver.litreview.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Papers nested as source collection → query → canonical tag → papers (insertion order).
 * Used both for the base classification and for the curated overlays.
 */
public class Hierarchy {

    public static final String UNCATEGORIZED = "uncategorized";

    private final Map<String, Map<String, Map<String, List<Paper>>>> collections = new LinkedHashMap<>();

    /**
     * Register a query under its collection so it is present even with no papers
     */
    public void addQuery(String collection, String query) {
        collections.computeIfAbsent(collection, k -> new LinkedHashMap<>())
            .computeIfAbsent(query, k -> new LinkedHashMap<>());
    }

    public void add(String collection, String query, String tag, Paper paper) {
        collections.computeIfAbsent(collection, k -> new LinkedHashMap<>())
            .computeIfAbsent(query, k -> new LinkedHashMap<>())
            .computeIfAbsent(tag, k -> new ArrayList<>())
            .add(paper);
    }

    public boolean isEmpty() {
        return collections.isEmpty();
    }

    public List<String> collections() {
        return List.copyOf(collections.keySet());
    }

    public List<String> queries(String collection) {
        return List.copyOf(collections.getOrDefault(collection, Map.of()).keySet());
    }

    /**
     * Tag buckets of a query in insertion order; empty when the query is unknown
     */
    public Map<String, List<Paper>> buckets(String collection, String query) {
        Map<String, List<Paper>> buckets = collections.getOrDefault(collection, Map.of()).get(query);
        return buckets == null ? Map.of() : Collections.unmodifiableMap(buckets);
    }

    public List<Paper> bucket(String collection, String query, String tag) {
        List<Paper> papers = buckets(collection, query).get(tag);
        return papers == null ? List.of() : Collections.unmodifiableList(papers);
    }

    /**
     * Bucket key of a query equal to {@code tag} ignoring case, in bucket insertion order
     */
    public Optional<String> resolveTag(QueryRef query, String tag) {
        String wanted = tag.toLowerCase(Locale.ROOT);
        return buckets(query.getCollection(), query.getQuery()).keySet().stream()
            .filter(key -> key.toLowerCase(Locale.ROOT).equals(wanted))
            .findFirst();
    }

    /**
     * First query (in hierarchy order) holding this exact paper instance in any bucket
     */
    public Optional<QueryRef> findQueryContaining(Paper paper) {
        for (var collection : collections.entrySet()) {
            for (var query : collection.getValue().entrySet()) {
                for (List<Paper> papers : query.getValue().values()) {
                    for (Paper candidate : papers) {
                        if (candidate == paper) {
                            return Optional.of(new QueryRef(collection.getKey(), query.getKey()));
                        }
                    }
                }
            }
        }
        return Optional.empty();
    }

    public int paperCount() {
        return collections.values().stream()
            .flatMap(queries -> queries.values().stream())
            .flatMap(buckets -> buckets.values().stream())
            .mapToInt(List::size)
            .sum();
    }

    @JsonValue
    public Map<String, Map<String, Map<String, List<Paper>>>> asMap() {
        return Collections.unmodifiableMap(collections);
    }
}
