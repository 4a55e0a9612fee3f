package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the append-only {@code dip_readings} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DipReading {

    private UUID id;

    private UUID tankId;

    private double valueLiters;

    private Double levelPercent;

    private Instant recordedAt;

    private String recordedBy;

    private Instant createdAt;
}
