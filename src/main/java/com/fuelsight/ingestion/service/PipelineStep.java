package com.fuelsight.ingestion.service;

/**
 * Per-record steps of the webhook pipeline, in execution order, and whether a
 * failure of the step aborts the record.
 *
 * Required steps persist the raw observation; a failure there skips the record.
 * Advisory steps are analytics; a failure is logged and the record carries on.
 */
public enum PipelineStep {

    TRANSFORM(true, "Transform failed"),
    UPSERT_LOCATION(true, "Location upsert failed"),
    FETCH_PREVIOUS_STATE(false, "Previous asset state lookup failed"),
    UPSERT_ASSET(true, "Asset upsert failed"),
    EVALUATE_ALERTS(false, "Alert evaluation failed"),
    PERSIST_ALERTS(false, "Alert persistence failed"),
    ESTIMATE_CONSUMPTION(false, "Consumption estimate failed"),
    OVERWRITE_CONSUMPTION(false, "Consumption overwrite failed"),
    INSERT_READING(true, "Reading insert failed");

    private final boolean required;
    private final String failurePrefix;

    PipelineStep(boolean required, String failurePrefix) {
        this.required = required;
        this.failurePrefix = failurePrefix;
    }

    public boolean isRequired() {
        return required;
    }

    public String failurePrefix() {
        return failurePrefix;
    }
}
