package com.dcruver.litreview.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dcruver.litreview.domain.TestPapers.paper;
import static com.dcruver.litreview.domain.TestPapers.paperWithDoi;
import static org.junit.jupiter.api.Assertions.*;

class CrossReferenceMatcherTest {

    private CrossReferenceMatcher matcher;
    private HierarchyBuilder builder;
    private Hierarchy hierarchy;
    private List<Paper> allPapers;

    @BeforeEach
    void setUp() {
        matcher = new CrossReferenceMatcher();
        builder = new HierarchyBuilder(new TermCanonicalizer());
        hierarchy = new Hierarchy();
        allPapers = new ArrayList<>();
    }

    private void addQuery(String collection, String query, Paper... papers) {
        builder.addQuery(hierarchy, collection, query, List.of(papers));
        allPapers.addAll(List.of(papers));
    }

    @Test
    void testDoiOnlyMatchGoesToLeastPopulatedTag() {
        Paper target = paperWithDoi("1", "Original title", "10.1/ABC", "CT", "MRI", "Neuro");
        addQuery("pubmed", "NLP",
            target,
            paper("2", "Two", "CT"),
            paper("3", "Three", "CT", "Neuro"));

        Paper curated = paperWithDoi("c1", "A different title", " 10.1/abc ", "ct", "neuro", "mri");

        Hierarchy overlay = matcher.overlay(List.of(curated), allPapers, hierarchy);

        // CT holds 3, Neuro 2, MRI 1
        assertEquals(List.of(target), overlay.bucket("pubmed", "NLP", "MRI"));
        assertEquals(1, overlay.paperCount());
    }

    @Test
    void testTitleMatchIsCaseAndWhitespaceInsensitive() {
        Paper target = paper("1", "Deep Learning for NLP", "CT");
        addQuery("pubmed", "NLP", target);

        Paper curated = paper("c1", "  deep learning for nlp ", "Ct");

        Hierarchy overlay = matcher.overlay(List.of(curated), allPapers, hierarchy);

        assertEquals(List.of(target), overlay.bucket("pubmed", "NLP", "CT"));
    }

    @Test
    void testCountTieGoesToFirstCuratedTag() {
        Paper target = paper("1", "Target", "CT", "MRI");
        addQuery("pubmed", "NLP", target);

        Hierarchy mriFirst = matcher.overlay(List.of(paper("c1", "Target", "mri", "ct")), allPapers, hierarchy);
        Hierarchy ctFirst = matcher.overlay(List.of(paper("c1", "Target", "ct", "mri")), allPapers, hierarchy);

        assertEquals(List.of(target), mriFirst.bucket("pubmed", "NLP", "MRI"));
        assertTrue(mriFirst.bucket("pubmed", "NLP", "CT").isEmpty());
        assertEquals(List.of(target), ctFirst.bucket("pubmed", "NLP", "CT"));
    }

    @Test
    void testFirstMatchingPaperInEncounterOrderWins() {
        Paper first = paper("1", "Shared title", "CT");
        Paper second = paper("2", "Shared title", "MRI");
        addQuery("pubmed", "First", first);
        addQuery("pubmed", "Second", second);

        Hierarchy overlay = matcher.overlay(List.of(paper("c1", "Shared title", "ct", "mri")), allPapers, hierarchy);

        assertEquals(List.of(first), overlay.bucket("pubmed", "First", "CT"));
        assertTrue(overlay.buckets("pubmed", "Second").isEmpty());
    }

    @Test
    void testUnmatchedAndUnresolvableItemsContributeNothing() {
        addQuery("pubmed", "NLP", paper("1", "Known", "CT"));

        List<Paper> curated = List.of(
            paper("c1", "Unknown title", "CT"),
            paper("c2", "Known", "Oncology"),
            paper("c3", "Known"));

        Hierarchy overlay = matcher.overlay(curated, allPapers, hierarchy);

        assertTrue(overlay.isEmpty());
    }

    @Test
    void testBlankTitlesAndDoisNeverMatch() {
        Paper target = paper("1", "Known", "CT");
        addQuery("pubmed", "NLP", target);

        Paper curated = Paper.builder().id(PaperId.parse("c1")).title("").branchTags(List.of("CT")).build();

        assertTrue(matcher.findMatch(curated, allPapers).isEmpty());
    }

    @Test
    void testOverlayDoesNotChangeBaseHierarchy() {
        addQuery("pubmed", "NLP", paper("1", "Known", "CT"));
        int before = hierarchy.paperCount();

        matcher.overlay(List.of(paper("c1", "Known", "CT")), allPapers, hierarchy);

        assertEquals(before, hierarchy.paperCount());
    }
}
