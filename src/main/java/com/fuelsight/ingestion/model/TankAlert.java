package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code tank_alerts} table.
 *
 * At most one active alert may exist per {@code (assetId, alertType)}; the table
 * carries a partial unique index on that pair {@code WHERE is_active}. Alerts are
 * resolved (deactivated) outside this service.
 *
 * {@code assetId} holds the telemetry asset id for webhook alerts and the fuel tank
 * id for manual-dip alerts; the two families use disjoint alert types.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankAlert {

    private UUID id;

    private UUID assetId;

    /** One of the {@link AlertType} codes. */
    private String alertType;

    /** One of the {@link AlertSeverity} codes. */
    private String severity;

    private String message;

    private Double currentValue;

    private Double thresholdValue;

    private Double previousValue;

    private boolean active;

    private Instant createdAt;
}
