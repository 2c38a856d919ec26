package com.dcruver.litreview.io;

import com.dcruver.litreview.domain.Paper;
import com.dcruver.litreview.domain.PaperId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads tag-based bibliographic export files (RIS style).
 * Each record is a run of {@code XX  - value} lines closed by an {@code ER} line.
 */
@Component
@Slf4j
public class RisFileReader {

    private static final Pattern RECORD_TERMINATOR = Pattern.compile("^ER(?:[ \\t]+-)?[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern FIELD_LINE = Pattern.compile("^([A-Z0-9]{2,3})\\s+-\\s+(.+)$");

    private static final String UNKNOWN_COLLECTION = "unknown";

    /**
     * Read and parse an export file. The source collection is taken from the file name.
     */
    public List<Paper> read(Path filePath) throws IOException {
        // Undecodable bytes are replaced rather than failing the whole file
        String content = new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
        List<Paper> papers = parse(content, collectionName(filePath));
        log.info("Parsed {} papers from {}", papers.size(), filePath.getFileName());
        return papers;
    }

    /**
     * Parse export text. Fallback identifiers restart at {@code paper_1} on every call.
     */
    public List<Paper> parse(String content, String sourceCollection) {
        List<Paper> papers = new ArrayList<>();
        int fallbackCounter = 1;
        int dropped = 0;

        for (String record : RECORD_TERMINATOR.split(content)) {
            if (record.isBlank()) {
                continue;
            }

            RisRecordDraft draft = parseRecord(record);
            Paper paper = draft.getPaper().sourceCollection(sourceCollection).build();

            if (paper.getTitle() == null || paper.getTitle().isEmpty()) {
                dropped++;
                continue;
            }

            PaperId id = draft.getId();
            if (id == null) {
                id = PaperId.fallback(fallbackCounter++);
            }
            papers.add(paper.withId(id));
        }

        if (dropped > 0) {
            log.debug("Dropped {} records without a title from {}", dropped, sourceCollection);
        }
        return papers;
    }

    /**
     * Source collection name: first underscore-delimited token of the file name, extension removed
     */
    public static String collectionName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String first = stem.split("_", -1)[0];
        return first.isEmpty() ? UNKNOWN_COLLECTION : first;
    }

    private RisRecordDraft parseRecord(String record) {
        RisRecordDraft draft = new RisRecordDraft();
        String currentCode = null;
        List<String> currentValue = new ArrayList<>();

        for (String rawLine : record.strip().split("\n")) {
            String line = rawLine.stripTrailing();
            if (line.isEmpty()) {
                continue;
            }

            Matcher matcher = FIELD_LINE.matcher(line);
            if (matcher.matches()) {
                if (currentCode != null) {
                    applyField(draft, currentCode, currentValue);
                }
                currentCode = matcher.group(1);
                currentValue = new ArrayList<>();
                currentValue.add(matcher.group(2));
            } else if (currentCode != null) {
                // Continuation of the previous field
                currentValue.add(line);
            }
        }

        if (currentCode != null) {
            applyField(draft, currentCode, currentValue);
        }
        return draft;
    }

    private void applyField(RisRecordDraft draft, String code, List<String> valueLines) {
        String value = String.join("\n", valueLines).strip();
        RisField.forCode(code).ifPresent(field -> field.apply(draft, value));
    }
}
