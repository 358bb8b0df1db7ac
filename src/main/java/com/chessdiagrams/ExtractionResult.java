package com.chessdiagrams;

import java.util.Collections;
import java.util.List;

/**
 * Records produced by a run together with its counters.
 */
public final class ExtractionResult<T> {

    private final List<T> records;
    private final ExtractionSummary summary;

    public ExtractionResult(List<T> records, ExtractionSummary summary) {
        this.records = Collections.unmodifiableList(records);
        this.summary = summary;
    }

    public List<T> getRecords() {
        return records;
    }

    public ExtractionSummary getSummary() {
        return summary;
    }
}
