package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One manually entered dip. {@code dipDate} accepts anything the timestamp
 * normalizer understands and defaults to now.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DipEntry(

        @JsonProperty("tank_name")
        String tankName,

        @JsonProperty("dip_value")
        Double dipValue,

        @JsonProperty("dip_date")
        Object dipDate,

        @JsonProperty("recorded_by")
        String recordedBy

) {
}
