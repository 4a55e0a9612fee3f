package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the append-only {@code agbot_readings_history} table.
 *
 * Readings are never updated after insert. They are the input series for
 * {@link com.fuelsight.ingestion.service.ConsumptionEstimator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankReading {

    private UUID id;

    private UUID assetId;

    private Double levelLiters;

    private double levelPercent;

    private double rawPercent;

    private Double depthM;

    private Double pressure;

    private Double pressureBar;

    private boolean online;

    private Double batteryVoltage;

    private Double temperatureC;

    private String deviceState;

    /** Vendor analytics valid at {@link #readingAt}. */
    private Double dailyConsumption;

    private Integer daysRemaining;

    private Instant readingAt;

    private Long telemetryEpoch;

    private Instant createdAt;
}
