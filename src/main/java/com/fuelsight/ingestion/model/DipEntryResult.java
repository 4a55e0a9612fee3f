package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Outcome of one dip entry. Failed entries carry {@code error} and no ids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DipEntryResult(

        @JsonProperty("tank_name")
        String tankName,

        @JsonProperty("success")
        boolean success,

        @JsonProperty("tank_id")
        UUID tankId,

        @JsonProperty("dip_id")
        UUID dipId,

        @JsonProperty("alerts_created")
        int alertsCreated,

        @JsonProperty("error")
        String error

) {

    public static DipEntryResult succeeded(String tankName, UUID tankId, UUID dipId, int alertsCreated) {
        return new DipEntryResult(tankName, true, tankId, dipId, alertsCreated, null);
    }

    public static DipEntryResult failed(String tankName, String error) {
        return new DipEntryResult(tankName, false, null, null, 0, error);
    }
}
