package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One tank record as pushed by the Gasbot dashboard webhook.
 *
 * Every field is optional and read through {@link #fromJson}, so a value of the
 * wrong JSON type degrades to {@code null} instead of rejecting the record. Numeric
 * vendor fields arrive either as JSON numbers or as strings, so they are kept as
 * {@code String} and parsed leniently by the transformer. Timestamp and epoch fields
 * are kept as {@code Object} so the normalizer can tell a numeric epoch apart from a
 * date string.
 */
public record GasbotTankPayload(

        // ---- Location ----------------------------------------------------
        String locationId,
        String locationGuid,
        String locationAddress,
        String locationState,
        String locationPostcode,
        String locationCountry,
        String locationLat,
        String locationLng,
        String locationCalibratedFillLevel,
        String locationDailyConsumption,
        String locationDaysRemaining,
        Integer locationInstallationStatus,
        Boolean locationDisabledStatus,
        Object locationLastCalibratedTelemetryTimestamp,
        Object locationLastCalibratedTelemetryEpoch,

        // ---- Customer ----------------------------------------------------
        String tenancyName,
        String customerGuid,

        // ---- Asset / tank ------------------------------------------------
        String assetGuid,
        String assetSerialNumber,
        String assetProfileName,
        String assetProfileGuid,
        String assetProfileCommodity,
        String assetProfileWaterCapacity,
        String assetProfileMaxDepth,
        String assetProfileMaxPressure,
        String assetProfileMaxPressureBar,
        String assetProfileMaxDisplayPercentageFill,
        String assetReportedLitres,
        String assetCalibratedFillLevel,
        String assetRawFillLevel,
        String assetRefillCapacityLitres,
        String assetDepth,
        String assetPressure,
        String assetPressureBar,
        String assetDailyConsumption,
        String assetDaysRemaining,
        Boolean assetDisabledStatus,
        Object assetLastCalibratedTelemetryTimestamp,
        Object assetLastCalibratedTelemetryEpoch,
        Object assetLastRawTelemetryTimestamp,
        Object assetLastRawTelemetryEpoch,
        Object assetUpdatedTimestamp,
        Object assetUpdatedEpoch,

        // ---- Device ------------------------------------------------------
        String deviceGuid,
        String deviceSerialNumber,
        String deviceModel,
        String deviceModelLabel,
        String deviceSku,
        String deviceNetworkId,
        Boolean deviceOnline,
        String deviceState,
        String deviceBatteryVoltage,
        String deviceTemperature,
        String deviceSignalStrength,
        Object deviceActivationTimestamp,
        Object deviceActivationEpoch,
        String helmetSerialNumber

) {

    /**
     * Reads a record field by field. A value of the wrong JSON type only loses that
     * attribute; it never fails the record.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GasbotTankPayload fromJson(JsonNode node) {
        return new GasbotTankPayload(
                JsonFields.text(node, "LocationId"),
                JsonFields.text(node, "LocationGuid"),
                JsonFields.text(node, "LocationAddress"),
                JsonFields.text(node, "LocationState"),
                JsonFields.text(node, "LocationPostcode"),
                JsonFields.text(node, "LocationCountry"),
                JsonFields.text(node, "LocationLat"),
                JsonFields.text(node, "LocationLng"),
                JsonFields.text(node, "LocationCalibratedFillLevel"),
                JsonFields.text(node, "LocationDailyConsumption"),
                JsonFields.text(node, "LocationDaysRemaining"),
                JsonFields.integer(node, "LocationInstallationStatus"),
                JsonFields.flag(node, "LocationDisabledStatus"),
                JsonFields.scalar(node, "LocationLastCalibratedTelemetryTimestamp"),
                JsonFields.scalar(node, "LocationLastCalibratedTelemetryEpoch"),
                JsonFields.text(node, "TenancyName"),
                JsonFields.text(node, "CustomerGuid"),
                JsonFields.text(node, "AssetGuid"),
                JsonFields.text(node, "AssetSerialNumber"),
                JsonFields.text(node, "AssetProfileName"),
                JsonFields.text(node, "AssetProfileGuid"),
                JsonFields.text(node, "AssetProfileCommodity"),
                JsonFields.text(node, "AssetProfileWaterCapacity"),
                JsonFields.text(node, "AssetProfileMaxDepth"),
                JsonFields.text(node, "AssetProfileMaxPressure"),
                JsonFields.text(node, "AssetProfileMaxPressureBar"),
                JsonFields.text(node, "AssetProfileMaxDisplayPercentageFill"),
                JsonFields.text(node, "AssetReportedLitres"),
                JsonFields.text(node, "AssetCalibratedFillLevel"),
                JsonFields.text(node, "AssetRawFillLevel"),
                JsonFields.text(node, "AssetRefillCapacityLitres"),
                JsonFields.text(node, "AssetDepth"),
                JsonFields.text(node, "AssetPressure"),
                JsonFields.text(node, "AssetPressureBar"),
                JsonFields.text(node, "AssetDailyConsumption"),
                JsonFields.text(node, "AssetDaysRemaining"),
                JsonFields.flag(node, "AssetDisabledStatus"),
                JsonFields.scalar(node, "AssetLastCalibratedTelemetryTimestamp"),
                JsonFields.scalar(node, "AssetLastCalibratedTelemetryEpoch"),
                JsonFields.scalar(node, "AssetLastRawTelemetryTimestamp"),
                JsonFields.scalar(node, "AssetLastRawTelemetryEpoch"),
                JsonFields.scalar(node, "AssetUpdatedTimestamp"),
                JsonFields.scalar(node, "AssetUpdatedEpoch"),
                JsonFields.text(node, "DeviceGuid"),
                JsonFields.text(node, "DeviceSerialNumber"),
                JsonFields.text(node, "DeviceModel"),
                JsonFields.text(node, "DeviceModelLabel"),
                JsonFields.text(node, "DeviceSKU"),
                JsonFields.text(node, "DeviceNetworkId"),
                JsonFields.flag(node, "DeviceOnline"),
                JsonFields.text(node, "DeviceState"),
                JsonFields.text(node, "DeviceBatteryVoltage"),
                JsonFields.text(node, "DeviceTemperature"),
                JsonFields.text(node, "DeviceSignalStrength"),
                JsonFields.scalar(node, "DeviceActivationTimestamp"),
                JsonFields.scalar(node, "DeviceActivationEpoch"),
                JsonFields.text(node, "HelmetSerialNumber"));
    }

    /** {@code true} only when the vendor explicitly reported the device as online. */
    public boolean reportsOnline() {
        return Boolean.TRUE.equals(deviceOnline);
    }
}
