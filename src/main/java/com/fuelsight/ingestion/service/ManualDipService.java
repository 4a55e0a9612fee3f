package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.exception.RecordRejectedException;
import com.fuelsight.ingestion.model.AlertEvent;
import com.fuelsight.ingestion.model.AlertSeverity;
import com.fuelsight.ingestion.model.AlertType;
import com.fuelsight.ingestion.model.DipBatchRequest;
import com.fuelsight.ingestion.model.DipBatchResponse;
import com.fuelsight.ingestion.model.DipEntry;
import com.fuelsight.ingestion.model.DipEntryResult;
import com.fuelsight.ingestion.model.DipReading;
import com.fuelsight.ingestion.model.DipRecordResult;
import com.fuelsight.ingestion.model.DipSummary;
import com.fuelsight.ingestion.model.FuelTank;
import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.model.SyncStatus;
import com.fuelsight.ingestion.repository.DipReadingRepository;
import com.fuelsight.ingestion.repository.FuelTankRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Records manually entered dip readings against fuel tanks.
 *
 * Each dip is checked against the tank bounds ({@code 0 <= value <= capacity}),
 * appended to {@code dip_readings}, copied to the tank's current level and then
 * evaluated against the two dip alert tiers. Alerting is best-effort and goes through
 * the same check-then-insert path as telemetry alerts.
 */
@Singleton
public class ManualDipService {

    private static final Logger log = LoggerFactory.getLogger(ManualDipService.class);

    static final String SYNC_TYPE = "manual_dip";

    private final FuelTankRepository fuelTankRepository;
    private final DipReadingRepository dipReadingRepository;
    private final TankNameResolver tankNameResolver;
    private final AlertEngine alertEngine;
    private final TimestampNormalizer timestamps;
    private final SyncLogService syncLogService;
    private final Clock clock;
    private final double lowPercent;
    private final double criticalPercent;

    @Inject
    public ManualDipService(FuelTankRepository fuelTankRepository,
                            DipReadingRepository dipReadingRepository,
                            TankNameResolver tankNameResolver,
                            AlertEngine alertEngine,
                            TimestampNormalizer timestamps,
                            SyncLogService syncLogService,
                            Clock clock,
                            @Value("${dip.low-percent:20}") double lowPercent,
                            @Value("${dip.critical-percent:10}") double criticalPercent) {
        this.fuelTankRepository = fuelTankRepository;
        this.dipReadingRepository = dipReadingRepository;
        this.tankNameResolver = tankNameResolver;
        this.alertEngine = alertEngine;
        this.timestamps = timestamps;
        this.syncLogService = syncLogService;
        this.clock = clock;
        this.lowPercent = lowPercent;
        this.criticalPercent = criticalPercent;
    }

    // -----------------------------------------------------------------------
    // Batch
    // -----------------------------------------------------------------------

    /**
     * Records every entry independently; one bad entry never stops the rest.
     */
    public DipBatchResponse recordBatch(DipBatchRequest request) {
        Instant startedAt = clock.instant();
        List<DipEntryResult> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int succeeded = 0;
        int alertsCreated = 0;

        for (DipEntry entry : request.dips()) {
            String tankName = entry.tankName();
            try {
                UUID tankId = resolveTank(tankName);
                if (entry.dipValue() == null) {
                    throw new RecordRejectedException(List.of("dip_value is required"));
                }
                Instant dipAt = entry.dipDate() == null
                        ? clock.instant()
                        : timestamps.normalizeInstant(entry.dipDate(), "dip_date");

                DipRecordResult recorded = recordDip(tankId, entry.dipValue(), dipAt, entry.recordedBy());
                results.add(DipEntryResult.succeeded(tankName, tankId, recorded.dipId(), recorded.alertsCreated()));
                succeeded++;
                alertsCreated += recorded.alertsCreated();

            } catch (RecordRejectedException e) {
                log.warn("Dip rejected tankName={}: {}", tankName, e.getMessage());
                results.add(DipEntryResult.failed(tankName, e.getMessage()));
                errors.add(tankName + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Dip failed tankName={}: {}", tankName, e.getMessage(), e);
                results.add(DipEntryResult.failed(tankName, e.getMessage()));
                errors.add(tankName + ": " + e.getMessage());
            }
        }

        int failed = results.size() - succeeded;
        Instant completedAt = clock.instant();
        syncLogService.record(SyncLog.builder()
                .syncType(SYNC_TYPE)
                .syncStatus(SyncStatus.of(succeeded, failed).code())
                .readingsProcessed(succeeded)
                .alertsCreated(alertsCreated)
                .errorMessage(syncLogService.summarize(errors))
                .syncDurationMs(Duration.between(startedAt, completedAt).toMillis())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build());

        log.info("Manual dips recorded total={} succeeded={} failed={} alertsCreated={}",
                results.size(), succeeded, failed, alertsCreated);
        return new DipBatchResponse(succeeded > 0,
                new DipSummary(results.size(), succeeded, failed, alertsCreated), results);
    }

    private UUID resolveTank(String tankName) {
        if (tankName == null || tankName.isBlank()) {
            throw new RecordRejectedException(List.of("tank_name is required"));
        }
        return tankNameResolver.resolve(tankName)
                .orElseThrow(() -> new RecordRejectedException(List.of("Tank not found: " + tankName.trim())));
    }

    // -----------------------------------------------------------------------
    // Single dip
    // -----------------------------------------------------------------------

    /**
     * Validates and stores one dip, updates the tank level and raises dip alerts.
     *
     * @throws RecordRejectedException when the tank does not exist or the value is out of bounds
     */
    public DipRecordResult recordDip(UUID tankId, double valueLiters, Instant dipAt, String recordedBy) {
        FuelTank tank = fuelTankRepository.findById(tankId)
                .orElseThrow(() -> new RecordRejectedException(List.of("Tank not found: " + tankId)));

        Double capacity = tank.getCapacityLiters();
        if (valueLiters < 0) {
            throw new RecordRejectedException(List.of("Dip value must not be negative: " + valueLiters));
        }
        if (capacity != null && capacity > 0 && valueLiters > capacity) {
            throw new RecordRejectedException(List.of(
                    "Dip value " + valueLiters + " exceeds tank capacity " + capacity));
        }
        Double levelPercent = capacity != null && capacity > 0 ? valueLiters * 100 / capacity : null;

        DipReading dip = dipReadingRepository.insert(DipReading.builder()
                .tankId(tankId)
                .valueLiters(valueLiters)
                .levelPercent(levelPercent)
                .recordedAt(dipAt)
                .recordedBy(recordedBy)
                .build());
        fuelTankRepository.updateCurrentLevel(tankId, valueLiters, levelPercent, dipAt);

        int alertsCreated = 0;
        try {
            alertsCreated = alertEngine.persist(evaluate(tank, levelPercent));
        } catch (RuntimeException e) {
            log.warn("Dip alert check failed fuelTankId={}: {}", tankId, e.getMessage());
        }

        return new DipRecordResult(tankId, dip.getId(), levelPercent != null ? levelPercent : 0, alertsCreated);
    }

    List<AlertEvent> evaluate(FuelTank tank, Double levelPercent) {
        if (levelPercent == null) {
            return List.of();
        }
        Double previousPercent = tank.getCurrentLevelPercent();
        if (levelPercent <= criticalPercent) {
            return List.of(new AlertEvent(tank.getId(), AlertType.DIP_CRITICAL, AlertSeverity.CRITICAL,
                    String.format("Manual dip: %s critically low at %.1f%%", tank.getName(), levelPercent),
                    levelPercent, criticalPercent, previousPercent));
        }
        if (levelPercent <= lowPercent) {
            return List.of(new AlertEvent(tank.getId(), AlertType.DIP_LOW, AlertSeverity.WARNING,
                    String.format("Manual dip: %s low at %.1f%%", tank.getName(), levelPercent),
                    levelPercent, lowPercent, previousPercent));
        }
        return List.of();
    }
}
