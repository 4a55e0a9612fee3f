package com.fuelsight.ingestion.exception;

import java.util.List;

/**
 * A single vendor record failed validation. Only that record is skipped.
 */
public class RecordRejectedException extends RuntimeException {

    private final List<String> reasons;

    public RecordRejectedException(List<String> reasons) {
        super(String.join(", ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
