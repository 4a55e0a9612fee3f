package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.GasbotTankPayload;
import com.fuelsight.ingestion.model.TankAsset;
import com.fuelsight.ingestion.model.TankLocation;
import com.fuelsight.ingestion.model.TankReading;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.UUID;

/**
 * Maps a Gasbot record onto the location, asset and reading shapes.
 *
 * All numeric extraction goes through {@link SafeNumbers}, so a malformed vendor
 * field only loses that attribute. The raw JSON is attached by the caller.
 */
@Singleton
public class GasbotPayloadTransformer {

    static final String DEFAULT_LOCATION_NAME = "Unknown Location";
    static final String DEFAULT_CUSTOMER_NAME = "Unknown Customer";
    static final String DEFAULT_COUNTRY = "Australia";
    static final String DEFAULT_ASSET_NAME = "Unknown Asset";
    static final String DEFAULT_PROFILE_NAME = "Gasbot Tank";
    static final String DEFAULT_PROFILE_GUID = "profile-gasbot-tank";
    static final int DEFAULT_DEVICE_MODEL = 43111;
    static final String DEFAULT_DEVICE_MODEL_NAME = "Gasbot Cellular Tank Monitor";

    private final TimestampNormalizer timestamps;

    @Inject
    public GasbotPayloadTransformer(TimestampNormalizer timestamps) {
        this.timestamps = timestamps;
    }

    // -----------------------------------------------------------------------
    // Location
    // -----------------------------------------------------------------------

    public TankLocation toLocation(GasbotTankPayload p) {
        String[] addressParts = p.locationAddress() == null
                ? new String[0]
                : Arrays.stream(p.locationAddress().split(",")).map(String::trim).toArray(String[]::new);

        boolean online = p.reportsOnline();
        Instant lastTelemetryAt = timestamps.normalizeInstant(
                firstPresent(p.locationLastCalibratedTelemetryTimestamp(), p.assetLastCalibratedTelemetryTimestamp()),
                "LocationLastCalibratedTelemetryTimestamp");
        Long lastTelemetryEpoch = TimestampNormalizer.epochToLong(p.locationLastCalibratedTelemetryEpoch());

        return TankLocation.builder()
                .externalGuid(hasText(p.locationGuid())
                        ? p.locationGuid()
                        : deriveGuid("location-", p.locationId()))
                .name(hasText(p.locationId()) ? p.locationId() : DEFAULT_LOCATION_NAME)
                .customerName(hasText(p.tenancyName()) ? p.tenancyName() : DEFAULT_CUSTOMER_NAME)
                .customerGuid(hasText(p.customerGuid())
                        ? p.customerGuid()
                        : deriveGuid("customer-", p.tenancyName()))
                .tenancyName(p.tenancyName())
                .address(p.locationAddress())
                .state(addressParts.length >= 3 ? addressParts[2] : p.locationState())
                .postcode(addressParts.length >= 4 ? addressParts[3] : p.locationPostcode())
                .country(hasText(p.locationCountry()) ? p.locationCountry() : DEFAULT_COUNTRY)
                .latitude(SafeNumbers.parseDouble(p.locationLat()))
                .longitude(SafeNumbers.parseDouble(p.locationLng()))
                .installationStatus(p.locationInstallationStatus() != null
                        ? p.locationInstallationStatus()
                        : (online ? 1 : 0))
                .installationStatusLabel(online ? "Active" : "Offline")
                .disabled(Boolean.TRUE.equals(p.locationDisabledStatus()))
                .dailyConsumptionLiters(SafeNumbers.parseDouble(p.locationDailyConsumption()))
                .daysRemaining(SafeNumbers.parseInteger(p.locationDaysRemaining()))
                .calibratedFillLevel(SafeNumbers.parseDouble(p.locationCalibratedFillLevel()))
                .lastTelemetryAt(lastTelemetryAt)
                .lastTelemetryEpoch(lastTelemetryEpoch != null ? lastTelemetryEpoch : lastTelemetryAt.toEpochMilli())
                .build();
    }

    // -----------------------------------------------------------------------
    // Asset
    // -----------------------------------------------------------------------

    public TankAsset toAsset(GasbotTankPayload p, UUID locationId) {
        Double litres = SafeNumbers.parseDouble(p.assetReportedLitres());
        Double capacity = SafeNumbers.parseDouble(p.assetProfileWaterCapacity());
        double levelPercent = levelPercent(SafeNumbers.parseDouble(p.assetCalibratedFillLevel()), litres, capacity);
        Integer vendorDaysRemaining = SafeNumbers.parseInteger(p.assetDaysRemaining());
        Integer deviceModel = SafeNumbers.parseInteger(p.deviceModel());

        Instant lastTelemetryAt = timestamps.normalizeInstant(
                p.assetLastCalibratedTelemetryTimestamp(), "AssetLastCalibratedTelemetryTimestamp");
        Long lastTelemetryEpoch = TimestampNormalizer.epochToLong(p.assetLastCalibratedTelemetryEpoch());

        return TankAsset.builder()
                .locationId(locationId)
                .externalGuid(hasText(p.assetGuid())
                        ? p.assetGuid()
                        : deriveGuid("asset-", hasText(p.assetSerialNumber()) ? p.assetSerialNumber() : p.deviceSerialNumber()))
                .name(hasText(p.assetSerialNumber())
                        ? p.assetSerialNumber()
                        : (hasText(p.assetProfileName()) ? p.assetProfileName() : DEFAULT_ASSET_NAME))
                .serialNumber(hasText(p.assetSerialNumber()) ? p.assetSerialNumber() : p.deviceSerialNumber())
                .profileName(hasText(p.assetProfileName()) ? p.assetProfileName() : DEFAULT_PROFILE_NAME)
                .profileGuid(hasText(p.assetProfileGuid()) ? p.assetProfileGuid() : DEFAULT_PROFILE_GUID)
                .commodity(p.assetProfileCommodity())
                .capacityLiters(capacity)
                .maxDepthM(SafeNumbers.parseDouble(p.assetProfileMaxDepth()))
                .maxPressure(SafeNumbers.parseDouble(p.assetProfileMaxPressure()))
                .maxPressureBar(SafeNumbers.parseDouble(p.assetProfileMaxPressureBar()))
                .maxDisplayPercent(SafeNumbers.parseDouble(p.assetProfileMaxDisplayPercentageFill()))
                .currentLevelLiters(litres)
                .currentLevelPercent(levelPercent)
                .currentRawPercent(rawPercent(p, levelPercent))
                .currentDepthM(SafeNumbers.parseDouble(p.assetDepth()))
                .currentPressure(SafeNumbers.parseDouble(p.assetPressure()))
                .currentPressureBar(SafeNumbers.parseDouble(p.assetPressureBar()))
                .ullageLiters(SafeNumbers.parseDouble(p.assetRefillCapacityLitres()))
                .dailyConsumptionLiters(SafeNumbers.parseDouble(p.assetDailyConsumption()))
                .daysRemaining(vendorDaysRemaining != null ? vendorDaysRemaining.doubleValue() : null)
                .deviceGuid(hasText(p.deviceGuid())
                        ? p.deviceGuid()
                        : "device-" + (hasText(p.deviceSerialNumber()) ? p.deviceSerialNumber() : "unknown"))
                .deviceSerial(p.deviceSerialNumber())
                .deviceModel(deviceModel != null ? deviceModel : DEFAULT_DEVICE_MODEL)
                .deviceModelName(hasText(p.deviceModelLabel()) ? p.deviceModelLabel() : DEFAULT_DEVICE_MODEL_NAME)
                .deviceSku(p.deviceSku())
                .deviceNetworkId(p.deviceNetworkId())
                .helmetSerial(p.helmetSerialNumber())
                .online(p.reportsOnline())
                .disabled(Boolean.TRUE.equals(p.assetDisabledStatus()))
                .deviceState(p.deviceState())
                .batteryVoltage(SafeNumbers.parseDouble(p.deviceBatteryVoltage()))
                .temperatureC(SafeNumbers.parseDouble(p.deviceTemperature()))
                .deviceActivatedAt(timestamps.normalizeIfPresent(p.deviceActivationTimestamp(), "DeviceActivationTimestamp"))
                .deviceActivationEpoch(TimestampNormalizer.epochToLong(p.deviceActivationEpoch()))
                .lastTelemetryAt(lastTelemetryAt)
                .lastTelemetryEpoch(lastTelemetryEpoch != null ? lastTelemetryEpoch : lastTelemetryAt.toEpochMilli())
                .lastRawTelemetryAt(timestamps.normalizeIfPresent(p.assetLastRawTelemetryTimestamp(), "AssetLastRawTelemetryTimestamp"))
                .lastRawTelemetryEpoch(TimestampNormalizer.epochToLong(p.assetLastRawTelemetryEpoch()))
                .lastCalibratedTelemetryAt(p.assetLastCalibratedTelemetryTimestamp() != null ? lastTelemetryAt : null)
                .lastCalibratedTelemetryEpoch(lastTelemetryEpoch)
                .assetUpdatedAt(timestamps.normalizeIfPresent(p.assetUpdatedTimestamp(), "AssetUpdatedTimestamp"))
                .assetUpdatedEpoch(TimestampNormalizer.epochToLong(p.assetUpdatedEpoch()))
                .build();
    }

    // -----------------------------------------------------------------------
    // Reading
    // -----------------------------------------------------------------------

    public TankReading toReading(GasbotTankPayload p, UUID assetId) {
        Double litres = SafeNumbers.parseDouble(p.assetReportedLitres());
        Double capacity = SafeNumbers.parseDouble(p.assetProfileWaterCapacity());
        double levelPercent = levelPercent(SafeNumbers.parseDouble(p.assetCalibratedFillLevel()), litres, capacity);

        Double dailyConsumption = SafeNumbers.parseDouble(p.assetDailyConsumption());
        Integer daysRemaining = SafeNumbers.parseInteger(p.assetDaysRemaining());
        Instant readingAt = timestamps.normalizeInstant(p.assetLastCalibratedTelemetryTimestamp(), "reading_at");
        Long telemetryEpoch = TimestampNormalizer.epochToLong(p.assetLastCalibratedTelemetryEpoch());

        return TankReading.builder()
                .assetId(assetId)
                .levelLiters(litres)
                .levelPercent(levelPercent)
                .rawPercent(rawPercent(p, levelPercent))
                .depthM(SafeNumbers.parseDouble(p.assetDepth()))
                .pressure(SafeNumbers.parseDouble(p.assetPressure()))
                .pressureBar(SafeNumbers.parseDouble(p.assetPressureBar()))
                .online(p.reportsOnline())
                .batteryVoltage(SafeNumbers.parseDouble(p.deviceBatteryVoltage()))
                .temperatureC(SafeNumbers.parseDouble(p.deviceTemperature()))
                .deviceState(p.deviceState())
                .dailyConsumption(dailyConsumption != null
                        ? dailyConsumption
                        : SafeNumbers.parseDouble(p.locationDailyConsumption()))
                .daysRemaining(daysRemaining != null
                        ? daysRemaining
                        : SafeNumbers.parseInteger(p.locationDaysRemaining()))
                .readingAt(readingAt)
                .telemetryEpoch(telemetryEpoch != null ? telemetryEpoch : readingAt.toEpochMilli())
                .build();
    }

    // -----------------------------------------------------------------------
    // Derivations
    // -----------------------------------------------------------------------

    /**
     * Fill percentage: the calibrated value when present (including 0), otherwise
     * {@code litres / capacity * 100} when both are known and capacity is positive,
     * otherwise 0. Always clamped to [0, 100].
     */
    static double levelPercent(Double calibratedPercent, Double litres, Double capacity) {
        if (calibratedPercent != null) {
            return clampPercent(calibratedPercent);
        }
        if (litres != null && capacity != null && capacity > 0) {
            return clampPercent(litres / capacity * 100);
        }
        return 0;
    }

    /**
     * Stable identifier derived from a human-readable name: lower-cased, whitespace
     * replaced by hyphens, everything except {@code [a-z0-9-]} removed.
     */
    static String deriveGuid(String prefix, String source) {
        String base = hasText(source) ? source : "unknown";
        String slug = base.trim()
                .replaceAll("\\s+", "-")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "");
        return prefix + slug;
    }

    static double clampPercent(double value) {
        return Math.max(0, Math.min(100, value));
    }

    private static double rawPercent(GasbotTankPayload p, double levelPercent) {
        Double raw = SafeNumbers.parseDouble(p.assetRawFillLevel());
        if (raw == null) {
            raw = SafeNumbers.parseDouble(p.assetCalibratedFillLevel());
        }
        return raw != null ? clampPercent(raw) : levelPercent;
    }

    private static Object firstPresent(Object first, Object second) {
        return first != null ? first : second;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
