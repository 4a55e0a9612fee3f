package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for a request that failed as a whole (configuration,
 * authentication or payload shape).
 */
public record FailureResponse(

        @JsonProperty("success")
        boolean success,

        @JsonProperty("error")
        String error,

        @JsonProperty("message")
        String message,

        @JsonProperty("duration")
        long duration

) {

    public static FailureResponse of(String error, String message, long duration) {
        return new FailureResponse(false, error, message, duration);
    }
}
