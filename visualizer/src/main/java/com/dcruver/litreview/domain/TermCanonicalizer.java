package com.dcruver.litreview.domain;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collapses case variants of branch tags ("CT", "Ct", "ct") onto one display form.
 * A table is built per query and is not shared between queries.
 */
@Component
public class TermCanonicalizer {

    /**
     * Build the lowercased-form to canonical-form table for one query's papers.
     * The canonical form is the variant with the most uppercase characters; ties go to the first seen.
     */
    public Map<String, String> buildTable(List<Paper> papers) {
        Map<String, Set<String>> variantsByKey = new LinkedHashMap<>();
        for (Paper paper : papers) {
            for (String tag : paper.getBranchTags()) {
                variantsByKey.computeIfAbsent(normalize(tag), k -> new LinkedHashSet<>()).add(tag);
            }
        }

        Map<String, String> table = new LinkedHashMap<>();
        variantsByKey.forEach((key, variants) -> table.put(key, pickCanonical(variants)));
        return table;
    }

    /**
     * Rewrite tags through a table. Tags missing from the table pass through unchanged.
     */
    public List<String> canonicalize(List<String> tags, Map<String, String> table) {
        List<String> result = new ArrayList<>(tags.size());
        for (String tag : tags) {
            result.add(table.getOrDefault(normalize(tag), tag));
        }
        return result;
    }

    static String normalize(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }

    static String pickCanonical(Iterable<String> variants) {
        String best = null;
        int bestCount = -1;
        for (String variant : variants) {
            int count = countUppercase(variant);
            // strictly greater keeps the earliest variant on ties
            if (count > bestCount) {
                best = variant;
                bestCount = count;
            }
        }
        return best;
    }

    private static int countUppercase(String text) {
        return (int) text.codePoints().filter(Character::isUpperCase).count();
    }
}
