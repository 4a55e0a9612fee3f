package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code POST /api/dips}. {@code success} is true when at least
 * one entry was recorded.
 */
public record DipBatchResponse(

        @JsonProperty("success")
        boolean success,

        @JsonProperty("summary")
        DipSummary summary,

        @JsonProperty("results")
        List<DipEntryResult> results

) {
}
