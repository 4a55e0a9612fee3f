package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code agbot_locations} table.
 *
 * A location is a physical site. {@code externalGuid} is the idempotency key: the
 * webhook upserts on it, so repeated delivery of the same site never creates a
 * second row. Rows are never deleted by the ingestion pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankLocation {

    /** Surrogate key generated by PostgreSQL ({@code gen_random_uuid()}). */
    private UUID id;

    /** Vendor GUID, or {@code location-<slug>} derived from the location name. */
    private String externalGuid;

    private String name;

    private String customerName;

    private String customerGuid;

    private String tenancyName;

    private String address;

    private String state;

    private String postcode;

    private String country;

    private Double latitude;

    private Double longitude;

    /** Vendor installation status code (1 = active). */
    private Integer installationStatus;

    private String installationStatusLabel;

    private boolean disabled;

    /** Aggregates mirrored from the primary asset as reported by the vendor. */
    private Double dailyConsumptionLiters;

    private Integer daysRemaining;

    private Double calibratedFillLevel;

    /** Last calibrated telemetry instant (UTC). */
    private Instant lastTelemetryAt;

    /** Epoch-millisecond twin of {@link #lastTelemetryAt}. */
    private Long lastTelemetryEpoch;

    /** Verbatim vendor record, stored as JSONB. */
    private String rawData;

    private Instant createdAt;

    private Instant updatedAt;
}
