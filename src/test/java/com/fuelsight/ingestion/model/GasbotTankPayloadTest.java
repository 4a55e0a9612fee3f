package com.fuelsight.ingestion.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GasbotTankPayloadTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("fields of the wrong JSON type read as unknown instead of failing the record")
    void wrongTypesDegradeToNull() throws Exception {
        GasbotTankPayload p = objectMapper.readValue("""
                {"LocationId":"Farm","AssetSerialNumber":"SN","DeviceOnline":"yes",
                 "LocationInstallationStatus":"Installed","LocationDisabledStatus":"N",
                 "AssetDisabledStatus":"no","LocationAddress":{"street":"1 Main Rd"},
                 "AssetLastCalibratedTelemetryTimestamp":["2025-05-31"]}
                """, GasbotTankPayload.class);

        assertThat(p.locationId()).isEqualTo("Farm");
        assertThat(p.assetSerialNumber()).isEqualTo("SN");
        assertThat(p.deviceOnline()).isNull();
        assertThat(p.reportsOnline()).isFalse();
        assertThat(p.locationInstallationStatus()).isNull();
        assertThat(p.locationDisabledStatus()).isNull();
        assertThat(p.assetDisabledStatus()).isNull();
        assertThat(p.locationAddress()).isNull();
        assertThat(p.assetLastCalibratedTelemetryTimestamp()).isNull();
    }

    @Test
    @DisplayName("flags accept booleans, 0/1 and true/false strings")
    void flagForms() throws Exception {
        GasbotTankPayload p = objectMapper.readValue("""
                {"DeviceOnline":1,"LocationDisabledStatus":"FALSE","AssetDisabledStatus":true,
                 "LocationInstallationStatus":"2.5"}
                """, GasbotTankPayload.class);

        assertThat(p.deviceOnline()).isTrue();
        assertThat(p.locationDisabledStatus()).isFalse();
        assertThat(p.assetDisabledStatus()).isTrue();
        assertThat(p.locationInstallationStatus()).isEqualTo(2);
    }

    @Test
    @DisplayName("numbers are kept as text and timestamps keep their JSON kind")
    void scalarsKeepTheirKind() throws Exception {
        GasbotTankPayload p = GasbotTankPayload.fromJson(objectMapper.readTree("""
                {"AssetReportedLitres":2500,"LocationId":17,
                 "AssetLastCalibratedTelemetryEpoch":1748649600,
                 "AssetLastCalibratedTelemetryTimestamp":"2025-05-31T00:00:00Z"}
                """));

        assertThat(p.assetReportedLitres()).isEqualTo("2500");
        assertThat(p.locationId()).isEqualTo("17");
        assertThat(p.assetLastCalibratedTelemetryEpoch()).isEqualTo(1748649600);
        assertThat(p.assetLastCalibratedTelemetryTimestamp()).isEqualTo("2025-05-31T00:00:00Z");
    }
}
