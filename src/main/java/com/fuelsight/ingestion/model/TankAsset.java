package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code agbot_assets} table.
 *
 * An asset is one monitored tank and belongs to exactly one {@link TankLocation}.
 * It holds the current snapshot of the tank; history lives in
 * {@link TankReading}. {@code currentLevelPercent} is always within [0, 100].
 *
 * Timestamp/epoch pairs:
 * <ul>
 *   <li>device activation</li>
 *   <li>last telemetry (calibrated reading used for display)</li>
 *   <li>last raw telemetry</li>
 *   <li>last calibrated telemetry</li>
 *   <li>last vendor-side asset update</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TankAsset {

    private UUID id;

    /** Owning location (FK to agbot_locations.id). */
    private UUID locationId;

    /** Vendor GUID, or {@code asset-<slug>} derived from the serial number. */
    private String externalGuid;

    // ---- Identity -------------------------------------------------------

    private String name;

    private String serialNumber;

    private String profileName;

    private String profileGuid;

    private String commodity;

    // ---- Dimensions -----------------------------------------------------

    private Double capacityLiters;

    private Double maxDepthM;

    private Double maxPressure;

    private Double maxPressureBar;

    private Double maxDisplayPercent;

    // ---- Current snapshot -----------------------------------------------

    private Double currentLevelLiters;

    private double currentLevelPercent;

    private double currentRawPercent;

    private Double currentDepthM;

    private Double currentPressure;

    private Double currentPressureBar;

    private Double ullageLiters;

    // ---- Consumption analytics ------------------------------------------

    private Double dailyConsumptionLiters;

    private Double daysRemaining;

    private Instant lastConsumptionCalcAt;

    private String consumptionCalcConfidence;

    // ---- Device ---------------------------------------------------------

    private String deviceGuid;

    private String deviceSerial;

    private Integer deviceModel;

    private String deviceModelName;

    private String deviceSku;

    private String deviceNetworkId;

    private String helmetSerial;

    private boolean online;

    private boolean disabled;

    private String deviceState;

    private Double batteryVoltage;

    private Double temperatureC;

    // ---- Timestamps -----------------------------------------------------

    private Instant deviceActivatedAt;

    private Long deviceActivationEpoch;

    private Instant lastTelemetryAt;

    private Long lastTelemetryEpoch;

    private Instant lastRawTelemetryAt;

    private Long lastRawTelemetryEpoch;

    private Instant lastCalibratedTelemetryAt;

    private Long lastCalibratedTelemetryEpoch;

    private Instant assetUpdatedAt;

    private Long assetUpdatedEpoch;

    /** Verbatim vendor record, stored as JSONB. */
    private String rawData;

    private Instant createdAt;

    private Instant updatedAt;
}
