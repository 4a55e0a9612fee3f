package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code fuel_tanks} table.
 *
 * Fuel tanks are managed through the admin UI; this service only reads them and
 * updates the current-level snapshot when a manual dip is recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FuelTank {

    private UUID id;

    private String name;

    private Double capacityLiters;

    private Double currentLevelLiters;

    private Double currentLevelPercent;

    private Instant lastDipAt;

    private Instant updatedAt;
}
