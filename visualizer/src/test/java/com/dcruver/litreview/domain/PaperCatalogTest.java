package com.dcruver.litreview.domain;

import com.dcruver.litreview.io.ContentLocatorResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PaperCatalogTest {

    private PaperCatalog catalog;
    private List<Paper> papers;

    @BeforeEach
    void setUp() {
        catalog = new PaperCatalog();
        papers = List.of(
            TestPapers.paper("1", "beta study").withYear(2020).withAbstractText("About extraction"),
            TestPapers.paper("2", "Alpha study").withYear(2023),
            TestPapers.paper("3", "Gamma notes"),
            TestPapers.paper("4", "Delta study").withYear(2023));
    }

    private static List<String> titles(List<Paper> papers) {
        return papers.stream().map(Paper::getTitle).toList();
    }

    @Test
    void testYearSortIsNewestFirst() {
        List<Paper> sorted = catalog.list(papers, "", PaperSort.YEAR);

        assertEquals(List.of("Delta study", "Alpha study", "beta study", "Gamma notes"), titles(sorted));
    }

    @Test
    void testTitleSortIgnoresCase() {
        List<Paper> sorted = catalog.list(papers, null, PaperSort.fromName("title"));

        assertEquals(List.of("Alpha study", "beta study", "Delta study", "Gamma notes"), titles(sorted));
    }

    @Test
    void testSearchMatchesTitleOrAbstract() {
        assertEquals(List.of("beta study"), titles(catalog.list(papers, "EXTRACTION", PaperSort.YEAR)));
        assertEquals(3, catalog.list(papers, "study", PaperSort.YEAR).size());
    }

    @Test
    void testListingKeepsDuplicates() {
        List<Paper> withDuplicate = List.of(papers.get(0), papers.get(0));

        assertEquals(2, catalog.list(withDuplicate, "", PaperSort.TITLE).size());
    }

    @Test
    void testFindById() {
        assertEquals("Alpha study", catalog.findById(papers, "2").orElseThrow().getTitle());
        assertTrue(catalog.findById(papers, "99").isEmpty());
    }

    @Test
    void testLocatorStatus() {
        Paper withLocator = papers.get(0).withContentLocator("internal-pdf://12/a.pdf");
        ContentLocatorResolver resolver = new ContentLocatorResolver() {
            @Override
            public boolean isAvailable(String locator) {
                return locator.contains("12");
            }

            @Override
            public Optional<String> resolve(String locator) {
                return Optional.of("/pdfs/12/a.pdf");
            }
        };

        LocatorStatus available = catalog.locatorStatus(withLocator, resolver);
        assertTrue(available.isAvailable());
        assertEquals("/pdfs/12/a.pdf", available.getLocation());

        LocatorStatus unavailable = catalog.locatorStatus(withLocator.withContentLocator("internal-pdf://9/b.pdf"), resolver);
        assertFalse(unavailable.isAvailable());
        assertNull(unavailable.getLocation());

        assertEquals("No content locator in record", catalog.locatorStatus(papers.get(1), resolver).getError());
        assertFalse(catalog.locatorStatus(withLocator, null).isAvailable());
    }
}
