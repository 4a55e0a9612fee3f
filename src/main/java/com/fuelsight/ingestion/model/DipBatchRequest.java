package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body for {@code POST /api/dips}.
 */
public record DipBatchRequest(

        @NotEmpty(message = "dips must contain at least one entry")
        @JsonProperty("dips")
        List<DipEntry> dips

) {
}
