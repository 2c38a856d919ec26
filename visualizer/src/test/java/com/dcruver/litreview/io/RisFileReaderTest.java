package com.dcruver.litreview.io;

import com.dcruver.litreview.domain.Paper;
import com.dcruver.litreview.domain.PaperId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing tag-based export files.
 */
class RisFileReaderTest {

    private RisFileReader reader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reader = new RisFileReader();
    }

    @Test
    void testRecordsWithoutTitleAreDropped() throws Exception {
        String content = """
            TY  - JOUR
            TI  - First paper
            ER  -\s

            TY  - JOUR
            AB  - An abstract but no title
            ER  -\s

            TY  - JOUR
            TI  - Third paper
            ER  -\s
            """;

        Path file = tempDir.resolve("pubmed_2024.txt");
        Files.writeString(file, content);

        List<Paper> papers = reader.read(file);

        assertEquals(2, papers.size());
        assertEquals("First paper", papers.get(0).getTitle());
        assertEquals("Third paper", papers.get(1).getTitle());
        assertTrue(papers.stream().allMatch(p -> p.getTitle() != null && !p.getTitle().isEmpty()));
    }

    @Test
    void testAllRecognizedFields() {
        String content = """
            TY  - JOUR
            ID  - 42
            TI  - Extracting phenotypes with LLMs
            PY  - 2023///
            AB  - We study extraction.
            AU  - Smith, J
            AU  - Doe, A
            AU  - Smith, J
            DO  - 10.1000/xyz
            N1  - llm, extraction, , nlp
            RN  - Radiology, CT
            L1  - internal-pdf://123/paper.pdf
            T2  - Journal of Tests
            VL  - 12
            IS  - 3
            SP  - 100-110
            UR  - https://example.org/paper
            KW  - language models
            KW  - phenotyping
            ZZ  - ignored
            ER  -\s
            """;

        List<Paper> papers = reader.parse(content, "pubmed");

        assertEquals(1, papers.size());
        Paper paper = papers.get(0);
        assertEquals(PaperId.parse("42"), paper.getId());
        assertTrue(paper.getId().isNumeric());
        assertEquals(2023, paper.getYear());
        assertEquals("We study extraction.", paper.getAbstractText());
        assertEquals(List.of("Smith, J", "Doe, A", "Smith, J"), paper.getAuthors());
        assertEquals("10.1000/xyz", paper.getDoi());
        assertEquals(List.of("llm", "extraction", "nlp"), paper.getUniqueSearchTerms());
        assertEquals(List.of("Radiology", "CT"), paper.getBranchTags());
        assertEquals("internal-pdf://123/paper.pdf", paper.getContentLocator());
        assertEquals("Journal of Tests", paper.getJournal());
        assertEquals("12", paper.getVolume());
        assertEquals("3", paper.getIssue());
        assertEquals("100-110", paper.getPages());
        assertEquals("https://example.org/paper", paper.getUrl());
        assertEquals(List.of("language models", "phenotyping"), paper.getKeywords());
        assertEquals("pubmed", paper.getSourceCollection());
    }

    @Test
    void testContinuationLinesAreJoined() {
        String content = """
            TI  - A title that
            wraps onto a second line
            AB  - First abstract line
            second abstract line
            ER  -\s
            """;

        Paper paper = reader.parse(content, "pubmed").get(0);

        assertEquals("A title that\nwraps onto a second line", paper.getTitle());
        assertEquals("First abstract line\nsecond abstract line", paper.getAbstractText());
    }

    @Test
    void testBareTerminatorLineSplitsRecords() {
        String content = "TI  - One\nER\nTI  - Two\nER   \n";

        List<Paper> papers = reader.parse(content, "pubmed");

        assertEquals(2, papers.size());
        assertEquals("Two", papers.get(1).getTitle());
    }

    @Test
    void testFallbackIdentifiersCountOnlyAssignedRecords() {
        String content = """
            TI  - No id one
            ER  -\s
            TI  - Has id
            ID  - abc-1
            ER  -\s
            TI  - No id two
            ER  -\s
            """;

        List<Paper> papers = reader.parse(content, "pubmed");

        assertEquals("paper_1", papers.get(0).getId().toString());
        assertEquals("abc-1", papers.get(1).getId().toString());
        assertFalse(papers.get(1).getId().isNumeric());
        assertEquals("paper_2", papers.get(2).getId().toString());

        // counter is scoped to one parse call
        List<Paper> again = reader.parse(content, "pubmed");
        assertEquals("paper_1", again.get(0).getId().toString());
    }

    @Test
    void testIdFieldTakesPriorityOverLabel() {
        String labelFirst = """
            TI  - Label first
            LB  - 7
            ID  - 9
            ER  -\s
            """;
        String idFirst = """
            TI  - Id first
            ID  - 9
            LB  - 7
            ER  -\s
            """;
        String labelOnly = """
            TI  - Label only
            LB  - lbl
            ER  -\s
            """;

        assertEquals("9", reader.parse(labelFirst, "x").get(0).getId().toString());
        assertEquals("9", reader.parse(idFirst, "x").get(0).getId().toString());
        assertEquals("lbl", reader.parse(labelOnly, "x").get(0).getId().toString());
    }

    @Test
    void testBranchTagsDropTrailingTerminatorArtifact() {
        String content = """
            TI  - Artifact
            RN  - radiology, CT
            ER
            """;
        String cancer = """
            TI  - Keeps real words
            RN  - oncology, CANCER
            ER  -\s
            """;

        // "ER" alone closes the record, so build the artifact case directly
        Paper artifact = reader.parse("TI  - Artifact\nRN  - radiology, CT ER\n", "x").get(0);

        assertEquals(List.of("radiology", "CT"), reader.parse(content, "x").get(0).getBranchTags());
        assertEquals(List.of("radiology", "CT"), artifact.getBranchTags());
        assertEquals(List.of("oncology", "CANCER"), reader.parse(cancer, "x").get(0).getBranchTags());
    }

    @Test
    void testCommaJoinedTerminatorArtifactIsNotATag() {
        Paper joined = reader.parse("TI  - Joined\nRN  - radiology, CT,ER\nER  - \n", "x").get(0);
        Paper alone = reader.parse("TI  - Alone\nRN  - ER\nER  - \n", "x").get(0);

        assertEquals(List.of("radiology", "CT"), joined.getBranchTags());
        assertTrue(alone.isUncategorized());
    }

    @Test
    void testEmptyBranchTagsMeanUncategorized() {
        Paper paper = reader.parse("TI  - Untagged\nRN  - ,\nER  - \n", "x").get(0);

        assertTrue(paper.getBranchTags().isEmpty());
        assertTrue(paper.isUncategorized());
    }

    @Test
    void testCollectionNameFromFileName() {
        assertEquals("pubmed", RisFileReader.collectionName(Path.of("/data/pubmed_2024_01.txt")));
        assertEquals("arxiv", RisFileReader.collectionName(Path.of("arxiv.txt")));
        assertEquals("unknown", RisFileReader.collectionName(Path.of("_leading.txt")));
    }

    @Test
    void testUnreadableFileFails() {
        Path missing = tempDir.resolve("pubmed_missing.txt");

        assertThrows(IOException.class, () -> reader.read(missing));
    }
}
