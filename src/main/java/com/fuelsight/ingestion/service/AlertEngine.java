package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.AlertEvent;
import com.fuelsight.ingestion.model.AlertSeverity;
import com.fuelsight.ingestion.model.AlertType;
import com.fuelsight.ingestion.model.GasbotTankPayload;
import com.fuelsight.ingestion.model.TankAlert;
import com.fuelsight.ingestion.model.TankAsset;
import com.fuelsight.ingestion.repository.AlertRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Threshold rules for telemetry assets, plus de-duplicated alert persistence shared
 * with the manual dip path.
 *
 * Rules are evaluated independently, so one asset may raise several alerts:
 * <ul>
 *   <li>battery below the warning voltage (warning) or the critical voltage (critical)</li>
 *   <li>fuel by days remaining when known, otherwise by fill percent; only one fuel alert per evaluation</li>
 *   <li>device offline, only on the online-to-offline edge</li>
 * </ul>
 */
@Singleton
public class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertRepository alertRepository;
    private final NewRelicEventService newRelicEventService;
    private final double batteryWarningVolts;
    private final double batteryCriticalVolts;
    private final double daysRemainingWarning;
    private final double daysRemainingCritical;
    private final double fillPercentWarning;
    private final double fillPercentCritical;

    @Inject
    public AlertEngine(AlertRepository alertRepository,
                       NewRelicEventService newRelicEventService,
                       @Value("${alerts.battery-warning-volts:3.3}") double batteryWarningVolts,
                       @Value("${alerts.battery-critical-volts:3.2}") double batteryCriticalVolts,
                       @Value("${alerts.days-remaining-warning:7}") double daysRemainingWarning,
                       @Value("${alerts.days-remaining-critical:3}") double daysRemainingCritical,
                       @Value("${alerts.fill-percent-warning:15}") double fillPercentWarning,
                       @Value("${alerts.fill-percent-critical:10}") double fillPercentCritical) {
        this.alertRepository = alertRepository;
        this.newRelicEventService = newRelicEventService;
        this.batteryWarningVolts = batteryWarningVolts;
        this.batteryCriticalVolts = batteryCriticalVolts;
        this.daysRemainingWarning = daysRemainingWarning;
        this.daysRemainingCritical = daysRemainingCritical;
        this.fillPercentWarning = fillPercentWarning;
        this.fillPercentCritical = fillPercentCritical;
    }

    // -----------------------------------------------------------------------
    // Evaluation
    // -----------------------------------------------------------------------

    /**
     * Works out which alerts the current state of an asset raises. Nothing is persisted.
     *
     * @param current  the asset as just upserted (must carry its id)
     * @param snapshot the vendor record the asset was built from, may be {@code null}
     * @param previous the stored asset before this delivery, {@code null} on first sight
     */
    public List<AlertEvent> evaluate(TankAsset current, GasbotTankPayload snapshot, TankAsset previous) {
        List<AlertEvent> events = new ArrayList<>();
        evaluateBattery(current, previous).ifPresent(events::add);
        evaluateFuel(current, snapshot, previous).ifPresent(events::add);
        evaluateOffline(current, previous).ifPresent(events::add);
        return events;
    }

    private Optional<AlertEvent> evaluateBattery(TankAsset current, TankAsset previous) {
        Double voltage = current.getBatteryVoltage();
        if (voltage == null) {
            return Optional.empty();
        }
        Double previousVoltage = previous != null ? previous.getBatteryVoltage() : null;
        if (voltage < batteryCriticalVolts) {
            return Optional.of(new AlertEvent(current.getId(), AlertType.LOW_BATTERY, AlertSeverity.CRITICAL,
                    String.format("Battery critically low: %.2fV (threshold %.2fV)", voltage, batteryCriticalVolts),
                    voltage, batteryCriticalVolts, previousVoltage));
        }
        if (voltage < batteryWarningVolts) {
            return Optional.of(new AlertEvent(current.getId(), AlertType.LOW_BATTERY, AlertSeverity.WARNING,
                    String.format("Battery low: %.2fV (threshold %.2fV)", voltage, batteryWarningVolts),
                    voltage, batteryWarningVolts, previousVoltage));
        }
        return Optional.empty();
    }

    private Optional<AlertEvent> evaluateFuel(TankAsset current, GasbotTankPayload snapshot, TankAsset previous) {
        Double daysRemaining = current.getDaysRemaining();
        if (daysRemaining == null && snapshot != null) {
            Integer locationDays = SafeNumbers.parseInteger(snapshot.locationDaysRemaining());
            daysRemaining = locationDays != null ? locationDays.doubleValue() : null;
        }

        // Days remaining takes precedence; the percent rule is not consulted when it is known.
        if (daysRemaining != null) {
            Double previousDays = previous != null ? previous.getDaysRemaining() : null;
            if (daysRemaining <= daysRemainingCritical) {
                return Optional.of(new AlertEvent(current.getId(), AlertType.CRITICAL_FUEL, AlertSeverity.CRITICAL,
                        String.format("Critical fuel: %.1f days remaining", daysRemaining),
                        daysRemaining, daysRemainingCritical, previousDays));
            }
            if (daysRemaining <= daysRemainingWarning) {
                return Optional.of(new AlertEvent(current.getId(), AlertType.LOW_FUEL, AlertSeverity.WARNING,
                        String.format("Low fuel: %.1f days remaining", daysRemaining),
                        daysRemaining, daysRemainingWarning, previousDays));
            }
            return Optional.empty();
        }

        if (!hasLevelSignal(current, snapshot)) {
            return Optional.empty();
        }
        double percent = current.getCurrentLevelPercent();
        Double previousPercent = previous != null ? previous.getCurrentLevelPercent() : null;
        if (percent <= fillPercentCritical) {
            return Optional.of(new AlertEvent(current.getId(), AlertType.CRITICAL_FUEL, AlertSeverity.CRITICAL,
                    String.format("Critical fuel: tank at %.1f%%", percent),
                    percent, fillPercentCritical, previousPercent));
        }
        if (percent <= fillPercentWarning) {
            return Optional.of(new AlertEvent(current.getId(), AlertType.LOW_FUEL, AlertSeverity.WARNING,
                    String.format("Low fuel: tank at %.1f%%", percent),
                    percent, fillPercentWarning, previousPercent));
        }
        return Optional.empty();
    }

    private Optional<AlertEvent> evaluateOffline(TankAsset current, TankAsset previous) {
        if (previous == null || !previous.isOnline() || current.isOnline()) {
            return Optional.empty();
        }
        return Optional.of(new AlertEvent(current.getId(), AlertType.DEVICE_OFFLINE, AlertSeverity.WARNING,
                "Device went offline" + (current.getDeviceSerial() != null ? ": " + current.getDeviceSerial() : ""),
                0d, null, 1d));
    }

    /**
     * A level of 0 only means "empty" when it was measured: a calibrated fill was
     * reported, or litres were reported for a tank of known capacity.
     */
    private static boolean hasLevelSignal(TankAsset current, GasbotTankPayload snapshot) {
        if (snapshot == null) {
            return true;
        }
        if (SafeNumbers.parseDouble(snapshot.assetCalibratedFillLevel()) != null) {
            return true;
        }
        Double capacity = current.getCapacityLiters();
        return current.getCurrentLevelLiters() != null && capacity != null && capacity > 0;
    }

    // -----------------------------------------------------------------------
    // Persistence
    // -----------------------------------------------------------------------

    /**
     * Inserts each event unless an active alert of the same type already exists for
     * the asset. Newly created alerts are published to the event sink.
     *
     * @return number of alerts actually inserted
     */
    public int persist(List<AlertEvent> events) {
        int created = 0;
        for (AlertEvent event : events) {
            String alertType = event.type().code();
            if (alertRepository.findActive(event.assetId(), alertType).isPresent()) {
                log.debug("Active alert exists, skipping assetId={} alertType={}", event.assetId(), alertType);
                continue;
            }
            TankAlert alert = event.toAlert();
            if (alertRepository.insertIfAbsent(alert)) {
                created++;
                log.info("Alert raised assetId={} alertType={} severity={} currentValue={}",
                        alert.getAssetId(), alertType, alert.getSeverity(), alert.getCurrentValue());
                newRelicEventService.emitAlertRaised(alert);
            }
        }
        return created;
    }
}
