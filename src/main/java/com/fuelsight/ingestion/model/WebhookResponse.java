package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for a webhook batch that reached the per-record stage.
 *
 * Partial failure still returns HTTP 200 with {@code success = true}; the
 * {@code errors} list (first few only) tells the caller which records failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(

        @JsonProperty("success")
        boolean success,

        @JsonProperty("message")
        String message,

        @JsonProperty("stats")
        IngestionStats stats,

        /** Omitted when every record succeeded. */
        @JsonProperty("errors")
        List<String> errors

) {
}
