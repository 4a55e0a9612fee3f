package com.fuelsight.ingestion.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fuelsight.ingestion.model.JsonFields;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks one Gasbot record before it is transformed.
 *
 * Errors reject the record: it must be a JSON object that identifies both its
 * location and its tank. Everything else (coordinates, levels, device health
 * readings, fields of the wrong JSON type) only produces warnings, since the
 * payload reader degrades bad values to "unknown" on its own.
 */
@Singleton
public class GasbotPayloadValidator {

    private static final List<String> FLAG_FIELDS =
            List.of("DeviceOnline", "LocationDisabledStatus", "AssetDisabledStatus");

    private static final List<String> TEXT_FIELDS = List.of(
            "LocationAddress", "LocationState", "LocationPostcode", "LocationCountry", "TenancyName",
            "AssetProfileName", "AssetProfileCommodity", "DeviceState", "DeviceModelLabel");

    public record ValidationResult(List<String> errors, List<String> warnings) {

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public ValidationResult validate(JsonNode record) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (record == null || !record.isObject()) {
            errors.add("Must be an object, got " + describe(record));
            return new ValidationResult(errors, warnings);
        }

        // ---- Location ----------------------------------------------------
        if (isBlank(record, "LocationId") && isBlank(record, "LocationGuid")) {
            errors.add("Missing required field: LocationId or LocationGuid");
        }
        JsonNode locationId = record.get("LocationId");
        if (locationId != null && !locationId.isNull() && !locationId.isTextual()) {
            errors.add("LocationId must be string, got " + describe(locationId));
        }
        checkRange(record, "LocationLat", -90, 90, warnings);
        checkRange(record, "LocationLng", -180, 180, warnings);
        checkRange(record, "LocationCalibratedFillLevel", 0, 100, warnings);

        // ---- Asset -------------------------------------------------------
        if (isBlank(record, "AssetSerialNumber") && isBlank(record, "DeviceSerialNumber")
                && isBlank(record, "AssetGuid")) {
            errors.add("Missing required field: AssetSerialNumber, DeviceSerialNumber, or AssetGuid");
        }
        if (present(record, "AssetProfileWaterCapacity")) {
            Double capacity = number(record, "AssetProfileWaterCapacity");
            if (capacity == null) {
                warnings.add("Invalid AssetProfileWaterCapacity: " + record.get("AssetProfileWaterCapacity"));
            } else if (capacity <= 0) {
                warnings.add("AssetProfileWaterCapacity must be positive: " + capacity);
            } else if (capacity > 1_000_000) {
                warnings.add("AssetProfileWaterCapacity suspiciously large: " + capacity + "L");
            }
        }
        if (present(record, "AssetReportedLitres")) {
            Double litres = number(record, "AssetReportedLitres");
            if (litres == null) {
                warnings.add("Invalid AssetReportedLitres: " + record.get("AssetReportedLitres"));
            } else if (litres < 0) {
                warnings.add("AssetReportedLitres is negative: " + litres);
            }
        }
        checkRange(record, "AssetCalibratedFillLevel", 0, 100, warnings);

        // ---- Device ------------------------------------------------------
        checkRange(record, "DeviceBatteryVoltage", 0, 20, warnings);
        checkRange(record, "DeviceTemperature", -50, 100, warnings);
        checkRange(record, "DeviceSignalStrength", -150, 0, warnings);

        // ---- Field shapes ------------------------------------------------
        for (String field : FLAG_FIELDS) {
            if (JsonFields.isMalformedFlag(record, field)) {
                warnings.add(field + " should be boolean, got " + record.get(field) + "; treated as unknown");
            }
        }
        for (String field : TEXT_FIELDS) {
            JsonNode value = record.get(field);
            if (value != null && value.isContainerNode()) {
                warnings.add(field + " should be text, got " + describe(value) + "; ignored");
            }
        }
        JsonNode installationStatus = record.get("LocationInstallationStatus");
        if (installationStatus != null && !installationStatus.isNull()
                && JsonFields.integer(record, "LocationInstallationStatus") == null) {
            warnings.add("Invalid LocationInstallationStatus: " + installationStatus + "; derived from DeviceOnline");
        }

        return new ValidationResult(errors, warnings);
    }

    private static void checkRange(JsonNode record, String field, double min, double max,
                                   List<String> warnings) {
        if (!present(record, field)) {
            return;
        }
        Double value = number(record, field);
        if (value == null) {
            warnings.add("Invalid " + field + ": " + record.get(field));
        } else if (value < min || value > max) {
            warnings.add(field + " out of range (" + min + " to " + max + "): " + value);
        }
    }

    private static boolean present(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node != null && !node.isNull();
    }

    private static boolean isBlank(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node == null || node.isNull() || node.asText().isBlank();
    }

    private static Double number(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node.isNumber() ? SafeNumbers.parseDouble(node.doubleValue()) : SafeNumbers.parseDouble(node.asText());
    }

    private static String describe(JsonNode node) {
        return node == null ? "null" : node.getNodeType().name().toLowerCase();
    }
}
