package com.fuelsight.ingestion.model;

/**
 * Outcome of one ingestion execution as recorded in {@code agbot_sync_logs}.
 */
public enum SyncStatus {

    /** Every record was persisted. */
    SUCCESS("success"),

    /** Some records failed; the rest were persisted. */
    PARTIAL("partial"),

    /** The request failed as a whole, or no record could be persisted. */
    ERROR("error");

    private final String code;

    SyncStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Status of a batch given how many records succeeded and failed.
     */
    public static SyncStatus of(int succeeded, int failed) {
        if (failed == 0) {
            return SUCCESS;
        }
        return succeeded == 0 ? ERROR : PARTIAL;
    }
}
