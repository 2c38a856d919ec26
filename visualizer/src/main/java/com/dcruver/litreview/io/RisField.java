package com.dcruver.litreview.io;

import com.dcruver.litreview.domain.PaperId;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Field codes understood by {@link RisFileReader}.
 * Codes outside this table are ignored.
 */
enum RisField {
    TI {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().title(value);
        }
    },
    PY {
        @Override
        void apply(RisRecordDraft draft, String value) {
            Matcher matcher = YEAR.matcher(value);
            if (matcher.find()) {
                draft.getPaper().year(Integer.parseInt(matcher.group()));
            }
        }
    },
    AB {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().abstractText(value);
        }
    },
    AU {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().author(value);
        }
    },
    DO {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().doi(value);
        }
    },
    N1 {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().clearUniqueSearchTerms().uniqueSearchTerms(splitTerms(value));
        }
    },
    RN {
        @Override
        void apply(RisRecordDraft draft, String value) {
            String clean = TRAILING_TERMINATOR.matcher(value).replaceFirst("").trim();
            draft.getPaper().clearBranchTags().branchTags(splitTerms(clean));
        }
    },
    L1 {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().contentLocator(value);
        }
    },
    T2 {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().journal(value);
        }
    },
    VL {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().volume(value);
        }
    },
    IS {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().issue(value);
        }
    },
    SP {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().pages(value);
        }
    },
    UR {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().url(value);
        }
    },
    KW {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.getPaper().keyword(value);
        }
    },
    ID {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.setPrimaryId(PaperId.parse(value));
        }
    },
    LB {
        @Override
        void apply(RisRecordDraft draft, String value) {
            draft.offerAlternateId(PaperId.parse(value));
        }
    };

    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    // A stray record terminator at the end of the notes field, e.g. "CT, MRI ER" or "CT,ER"
    private static final Pattern TRAILING_TERMINATOR = Pattern.compile("(^|[\\s,])ER$");

    private static final Map<String, RisField> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    abstract void apply(RisRecordDraft draft, String value);

    static Optional<RisField> forCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Comma-split, trim, drop empty tokens
     */
    static List<String> splitTerms(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(term -> !term.isEmpty())
            .toList();
    }
}
