package com.fuelsight.ingestion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.AlertEvent;
import com.fuelsight.ingestion.model.AlertSeverity;
import com.fuelsight.ingestion.model.AlertType;
import com.fuelsight.ingestion.model.GasbotTankPayload;
import com.fuelsight.ingestion.model.TankAlert;
import com.fuelsight.ingestion.model.TankAsset;
import com.fuelsight.ingestion.repository.AlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertEngineTest {

    private static final UUID ASSET_ID = UUID.randomUUID();

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private NewRelicEventService newRelicEventService;

    @Captor
    private ArgumentCaptor<TankAlert> alertCaptor;

    private AlertEngine alertEngine;

    @BeforeEach
    void setUp() {
        alertEngine = new AlertEngine(alertRepository, newRelicEventService, 3.3, 3.2, 7, 3, 15, 10);
    }

    private static TankAsset.TankAssetBuilder asset() {
        return TankAsset.builder()
                .id(ASSET_ID)
                .deviceSerial("DEV-1")
                .online(true)
                .currentLevelPercent(60);
    }

    private static GasbotTankPayload snapshot(String json) throws Exception {
        return new ObjectMapper().readValue(json, GasbotTankPayload.class);
    }

    // -----------------------------------------------------------------------
    // Evaluation
    // -----------------------------------------------------------------------

    @Test
    @DisplayName("battery between the thresholds is a warning, below critical is critical")
    void batteryTiers() {
        List<AlertEvent> warning = alertEngine.evaluate(asset().batteryVoltage(3.25).build(), null, null);
        List<AlertEvent> critical = alertEngine.evaluate(asset().batteryVoltage(3.1).build(), null, null);
        List<AlertEvent> healthy = alertEngine.evaluate(asset().batteryVoltage(3.3).build(), null, null);

        assertThat(warning).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(AlertType.LOW_BATTERY);
            assertThat(e.severity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(e.thresholdValue()).isEqualTo(3.3);
        });
        assertThat(critical).singleElement().satisfies(e -> {
            assertThat(e.severity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(e.currentValue()).isEqualTo(3.1);
        });
        assertThat(healthy).isEmpty();
    }

    @Test
    @DisplayName("days remaining takes precedence over fill percent")
    void daysRemainingTakesPrecedence() {
        TankAsset lowPercentButManyDays = asset().currentLevelPercent(5).daysRemaining(30d).build();
        TankAsset criticalDays = asset().daysRemaining(2d).build();
        TankAsset lowDays = asset().daysRemaining(7d).build();

        assertThat(alertEngine.evaluate(lowPercentButManyDays, null, null)).isEmpty();
        assertThat(alertEngine.evaluate(criticalDays, null, null)).singleElement()
                .satisfies(e -> {
                    assertThat(e.type()).isEqualTo(AlertType.CRITICAL_FUEL);
                    assertThat(e.message()).isEqualTo("Critical fuel: 2.0 days remaining");
                });
        assertThat(alertEngine.evaluate(lowDays, null, null)).singleElement()
                .extracting(AlertEvent::type).isEqualTo(AlertType.LOW_FUEL);
    }

    @Test
    @DisplayName("location days remaining from the snapshot is used when the asset has none")
    void fallsBackToLocationDays() throws Exception {
        GasbotTankPayload snapshot = snapshot("{\"LocationDaysRemaining\":\"3\",\"AssetCalibratedFillLevel\":80}");

        List<AlertEvent> events = alertEngine.evaluate(asset().currentLevelPercent(80).build(), snapshot, null);

        assertThat(events).singleElement().extracting(AlertEvent::type).isEqualTo(AlertType.CRITICAL_FUEL);
    }

    @Test
    @DisplayName("fill percent tiers apply when days remaining is unknown")
    void percentFallback() throws Exception {
        GasbotTankPayload snapshot = snapshot("{\"AssetCalibratedFillLevel\":12}");

        List<AlertEvent> low = alertEngine.evaluate(asset().currentLevelPercent(12).build(), snapshot, null);
        List<AlertEvent> critical = alertEngine.evaluate(asset().currentLevelPercent(10).build(), null,
                asset().currentLevelPercent(11).build());

        assertThat(low).singleElement().extracting(AlertEvent::type).isEqualTo(AlertType.LOW_FUEL);
        assertThat(critical).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(AlertType.CRITICAL_FUEL);
            assertThat(e.previousValue()).isEqualTo(11.0);
        });
    }

    @Test
    @DisplayName("a zero level with no reported level does not raise a fuel alert")
    void noLevelSignalNoFuelAlert() throws Exception {
        GasbotTankPayload snapshot = snapshot("{\"LocationId\":\"Farm\"}");

        assertThat(alertEngine.evaluate(asset().currentLevelPercent(0).build(), snapshot, null)).isEmpty();
    }

    @Test
    @DisplayName("litres without a capacity give no fill percent and no fuel alert")
    void litresWithoutCapacityIsUnknownLevel() throws Exception {
        GasbotTankPayload snapshot = snapshot("{\"LocationId\":\"Farm\",\"AssetReportedLitres\":5000}");
        TankAsset asset = asset().currentLevelPercent(0).currentLevelLiters(5000d).build();

        assertThat(alertEngine.evaluate(asset, snapshot, null)).isEmpty();
    }

    @Test
    @DisplayName("litres on a tank of known capacity count as a measured level")
    void litresWithCapacityIsMeasured() throws Exception {
        GasbotTankPayload snapshot = snapshot(
                "{\"LocationId\":\"Farm\",\"AssetReportedLitres\":500,\"AssetProfileWaterCapacity\":10000}");
        TankAsset asset = asset().currentLevelPercent(5).currentLevelLiters(500d).capacityLiters(10000d).build();

        assertThat(alertEngine.evaluate(asset, snapshot, null)).singleElement()
                .extracting(AlertEvent::type).isEqualTo(AlertType.CRITICAL_FUEL);
    }

    @Test
    @DisplayName("offline alert only fires on the online to offline edge")
    void offlineEdge() {
        TankAsset offline = asset().online(false).build();

        List<AlertEvent> edge = alertEngine.evaluate(offline, null, asset().online(true).build());

        assertThat(edge).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(AlertType.DEVICE_OFFLINE);
            assertThat(e.currentValue()).isZero();
            assertThat(e.previousValue()).isEqualTo(1.0);
            assertThat(e.message()).isEqualTo("Device went offline: DEV-1");
        });
        assertThat(alertEngine.evaluate(offline, null, asset().online(false).build())).isEmpty();
        assertThat(alertEngine.evaluate(offline, null, null)).isEmpty();
    }

    @Test
    @DisplayName("several rules can fire for the same asset")
    void multipleAlerts() {
        TankAsset asset = asset().batteryVoltage(3.0).daysRemaining(1d).online(false).build();

        List<AlertEvent> events = alertEngine.evaluate(asset, null, asset().build());

        assertThat(events).extracting(AlertEvent::type)
                .containsExactly(AlertType.LOW_BATTERY, AlertType.CRITICAL_FUEL, AlertType.DEVICE_OFFLINE);
    }

    // -----------------------------------------------------------------------
    // Persistence
    // -----------------------------------------------------------------------

    private static AlertEvent lowBattery() {
        return new AlertEvent(ASSET_ID, AlertType.LOW_BATTERY, AlertSeverity.WARNING, "Battery low", 3.25, 3.3, null);
    }

    @Test
    @DisplayName("new alerts are inserted and published")
    void persistsNewAlert() {
        when(alertRepository.findActive(ASSET_ID, "low_battery")).thenReturn(Optional.empty());
        when(alertRepository.insertIfAbsent(any(TankAlert.class))).thenReturn(true);

        int created = alertEngine.persist(List.of(lowBattery()));

        assertThat(created).isEqualTo(1);
        verify(alertRepository).insertIfAbsent(alertCaptor.capture());
        TankAlert saved = alertCaptor.getValue();
        assertThat(saved.getAlertType()).isEqualTo("low_battery");
        assertThat(saved.getSeverity()).isEqualTo("warning");
        assertThat(saved.isActive()).isTrue();
        verify(newRelicEventService).emitAlertRaised(saved);
    }

    @Test
    @DisplayName("an existing active alert of the same type suppresses the insert")
    void skipsDuplicateAlert() {
        when(alertRepository.findActive(ASSET_ID, "low_battery"))
                .thenReturn(Optional.of(TankAlert.builder().assetId(ASSET_ID).alertType("low_battery").active(true).build()));

        int created = alertEngine.persist(List.of(lowBattery()));

        assertThat(created).isZero();
        verify(alertRepository, never()).insertIfAbsent(any());
        verify(newRelicEventService, never()).emitAlertRaised(any());
    }

    @Test
    @DisplayName("losing the insert race to a concurrent delivery is not counted")
    void concurrentInsertNotCounted() {
        when(alertRepository.findActive(ASSET_ID, "low_battery")).thenReturn(Optional.empty());
        when(alertRepository.insertIfAbsent(any(TankAlert.class))).thenReturn(false);

        assertThat(alertEngine.persist(List.of(lowBattery()))).isZero();
        verify(newRelicEventService, never()).emitAlertRaised(any());
    }

    @Test
    @DisplayName("repository failures propagate to the caller")
    void persistenceFailurePropagates() {
        when(alertRepository.findActive(ASSET_ID, "low_battery"))
                .thenThrow(new PersistenceException("db down", null));

        assertThatThrownBy(() -> alertEngine.persist(List.of(lowBattery())))
                .hasMessage("db down");
    }
}
