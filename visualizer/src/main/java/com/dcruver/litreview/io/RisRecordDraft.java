package com.dcruver.litreview.io;

import com.dcruver.litreview.domain.Paper;
import com.dcruver.litreview.domain.PaperId;
import lombok.Getter;

/**
 * Mutable accumulator for one record while its fields are being read.
 */
@Getter
class RisRecordDraft {

    private final Paper.PaperBuilder paper = Paper.builder();
    private PaperId id;

    /**
     * ID field: always wins over LB, regardless of order
     */
    void setPrimaryId(PaperId value) {
        id = value;
    }

    /**
     * LB field: used only while no identifier has been set
     */
    void offerAlternateId(PaperId value) {
        if (id == null) {
            id = value;
        }
    }
}
