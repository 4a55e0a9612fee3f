package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.AlertEvent;
import com.fuelsight.ingestion.model.AlertSeverity;
import com.fuelsight.ingestion.model.AlertType;
import com.fuelsight.ingestion.model.DipBatchRequest;
import com.fuelsight.ingestion.model.DipBatchResponse;
import com.fuelsight.ingestion.model.DipEntry;
import com.fuelsight.ingestion.model.DipEntryResult;
import com.fuelsight.ingestion.model.DipReading;
import com.fuelsight.ingestion.model.DipRecordResult;
import com.fuelsight.ingestion.model.FuelTank;
import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.exception.RecordRejectedException;
import com.fuelsight.ingestion.repository.DipReadingRepository;
import com.fuelsight.ingestion.repository.FuelTankRepository;
import com.fuelsight.ingestion.repository.SyncLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ManualDipServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final UUID TANK_ID = UUID.randomUUID();

    @Mock
    private FuelTankRepository fuelTankRepository;

    @Mock
    private DipReadingRepository dipReadingRepository;

    @Mock
    private TankNameResolver tankNameResolver;

    @Mock
    private AlertEngine alertEngine;

    @Mock
    private SyncLogRepository syncLogRepository;

    @Mock
    private NewRelicEventService newRelicEventService;

    @Captor
    private ArgumentCaptor<DipReading> dipCaptor;

    @Captor
    private ArgumentCaptor<SyncLog> syncLogCaptor;

    private ManualDipService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new ManualDipService(
                fuelTankRepository,
                dipReadingRepository,
                tankNameResolver,
                alertEngine,
                new TimestampNormalizer(clock),
                new SyncLogService(syncLogRepository, newRelicEventService, 3, 1000),
                clock,
                20,
                10);
    }

    private static FuelTank tank(Double capacity) {
        return FuelTank.builder()
                .id(TANK_ID)
                .name("Main Diesel")
                .capacityLiters(capacity)
                .currentLevelPercent(40d)
                .build();
    }

    private void stubTank(Double capacity) {
        lenient().when(fuelTankRepository.findById(TANK_ID)).thenReturn(Optional.of(tank(capacity)));
        lenient().when(dipReadingRepository.insert(any(DipReading.class))).thenAnswer(inv -> {
            DipReading dip = inv.getArgument(0);
            dip.setId(UUID.randomUUID());
            return dip;
        });
    }

    // -----------------------------------------------------------------------
    // Single dip
    // -----------------------------------------------------------------------

    @Test
    @DisplayName("a valid dip is stored, copied to the tank and checked for alerts")
    void recordsDip() {
        // Arrange
        stubTank(1000d);
        when(alertEngine.persist(anyList())).thenReturn(1);

        // Act
        DipRecordResult result = service.recordDip(TANK_ID, 150, NOW, "jo");

        // Assert
        assertThat(result.tankId()).isEqualTo(TANK_ID);
        assertThat(result.dipId()).isNotNull();
        assertThat(result.levelPercent()).isEqualTo(15.0);
        assertThat(result.alertsCreated()).isEqualTo(1);

        verify(dipReadingRepository).insert(dipCaptor.capture());
        assertThat(dipCaptor.getValue().getValueLiters()).isEqualTo(150.0);
        assertThat(dipCaptor.getValue().getRecordedBy()).isEqualTo("jo");
        verify(fuelTankRepository).updateCurrentLevel(TANK_ID, 150, 15.0, NOW);
    }

    @Test
    @DisplayName("values outside the tank bounds are rejected before anything is written")
    void rejectsOutOfBounds() {
        stubTank(1000d);

        assertThatThrownBy(() -> service.recordDip(TANK_ID, -1, NOW, null))
                .isInstanceOf(RecordRejectedException.class)
                .hasMessage("Dip value must not be negative: -1.0");
        assertThatThrownBy(() -> service.recordDip(TANK_ID, 1000.5, NOW, null))
                .isInstanceOf(RecordRejectedException.class)
                .hasMessage("Dip value 1000.5 exceeds tank capacity 1000.0");
        verify(dipReadingRepository, never()).insert(any());
    }

    @Test
    @DisplayName("a dip equal to capacity is accepted")
    void acceptsFullTank() {
        stubTank(1000d);

        assertThat(service.recordDip(TANK_ID, 1000, NOW, null).levelPercent()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("a tank without capacity stores the dip with no percentage")
    void noCapacityNoPercent() {
        stubTank(null);

        DipRecordResult result = service.recordDip(TANK_ID, 5000, NOW, null);

        assertThat(result.levelPercent()).isZero();
        verify(fuelTankRepository).updateCurrentLevel(TANK_ID, 5000, null, NOW);
    }

    @Test
    @DisplayName("alert failures do not fail the dip")
    void alertFailureIsBestEffort() {
        stubTank(1000d);
        when(alertEngine.persist(anyList())).thenThrow(new IllegalStateException("alerts down"));

        DipRecordResult result = service.recordDip(TANK_ID, 50, NOW, null);

        assertThat(result.alertsCreated()).isZero();
        verify(fuelTankRepository).updateCurrentLevel(TANK_ID, 50, 5.0, NOW);
    }

    @Test
    @DisplayName("dip alert tiers")
    void alertTiers() {
        FuelTank tank = tank(1000d);

        List<AlertEvent> critical = service.evaluate(tank, 10.0);
        List<AlertEvent> low = service.evaluate(tank, 18.0);

        assertThat(critical).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(AlertType.DIP_CRITICAL);
            assertThat(e.severity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(e.assetId()).isEqualTo(TANK_ID);
            assertThat(e.previousValue()).isEqualTo(40.0);
        });
        assertThat(low).singleElement().extracting(AlertEvent::type).isEqualTo(AlertType.DIP_LOW);
        assertThat(service.evaluate(tank, 20.5)).isEmpty();
        assertThat(service.evaluate(tank, null)).isEmpty();
    }

    // -----------------------------------------------------------------------
    // Batch
    // -----------------------------------------------------------------------

    @Test
    @DisplayName("each entry succeeds or fails on its own and one sync log is written")
    void batchWithFailures() {
        // Arrange
        stubTank(1000d);
        when(tankNameResolver.resolve("Main Diesel")).thenReturn(Optional.of(TANK_ID));
        when(tankNameResolver.resolve("Ghost")).thenReturn(Optional.empty());
        DipBatchRequest request = new DipBatchRequest(Arrays.asList(
                new DipEntry("Main Diesel", 500d, "2025-05-31T10:00:00+10:00", "jo"),
                new DipEntry("Ghost", 100d, null, null),
                new DipEntry(" ", 100d, null, null),
                new DipEntry("Main Diesel", null, null, null),
                new DipEntry("Main Diesel", 2000d, null, null)));

        // Act
        DipBatchResponse response = service.recordBatch(request);

        // Assert
        assertThat(response.success()).isTrue();
        assertThat(response.summary().total()).isEqualTo(5);
        assertThat(response.summary().succeeded()).isEqualTo(1);
        assertThat(response.summary().failed()).isEqualTo(4);
        assertThat(response.results()).extracting(DipEntryResult::error).containsExactly(
                null,
                "Tank not found: Ghost",
                "tank_name is required",
                "dip_value is required",
                "Dip value 2000.0 exceeds tank capacity 1000.0");
        assertThat(response.results().get(0).tankId()).isEqualTo(TANK_ID);

        verify(dipReadingRepository).insert(dipCaptor.capture());
        assertThat(dipCaptor.getValue().getRecordedAt()).isEqualTo(Instant.parse("2025-05-31T00:00:00Z"));

        verify(syncLogRepository).insert(syncLogCaptor.capture());
        SyncLog syncLog = syncLogCaptor.getValue();
        assertThat(syncLog.getSyncType()).isEqualTo("manual_dip");
        assertThat(syncLog.getSyncStatus()).isEqualTo("partial");
        assertThat(syncLog.getReadingsProcessed()).isEqualTo(1);
        assertThat(syncLog.getErrorMessage()).startsWith("Ghost: Tank not found: Ghost");
    }

    @Test
    @DisplayName("a batch where nothing was recorded is unsuccessful")
    void batchAllFailed() {
        when(tankNameResolver.resolve(any())).thenReturn(Optional.empty());
        List<DipEntry> dips = new ArrayList<>();
        dips.add(new DipEntry("Nowhere", 10d, null, null));

        DipBatchResponse response = service.recordBatch(new DipBatchRequest(dips));

        assertThat(response.success()).isFalse();
        assertThat(response.summary().failed()).isEqualTo(1);
        verify(syncLogRepository).insert(syncLogCaptor.capture());
        assertThat(syncLogCaptor.getValue().getSyncStatus()).isEqualTo("error");
        verify(fuelTankRepository, never()).updateCurrentLevel(any(), anyDouble(), any(), any());
    }
}
