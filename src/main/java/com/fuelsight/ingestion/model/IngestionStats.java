package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters returned in the webhook response body.
 */
public record IngestionStats(

        @JsonProperty("totalRecords")
        int totalRecords,

        @JsonProperty("processedRecords")
        int processedRecords,

        @JsonProperty("errorCount")
        int errorCount,

        /** Wall-clock processing time in milliseconds. */
        @JsonProperty("duration")
        long duration

) {
}
