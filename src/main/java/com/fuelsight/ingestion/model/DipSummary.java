package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DipSummary(

        @JsonProperty("total")
        int total,

        @JsonProperty("succeeded")
        int succeeded,

        @JsonProperty("failed")
        int failed,

        @JsonProperty("alertsCreated")
        int alertsCreated

) {
}
