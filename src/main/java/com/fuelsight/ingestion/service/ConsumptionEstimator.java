package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.ConsumptionConfidence;
import com.fuelsight.ingestion.model.ConsumptionEstimate;
import com.fuelsight.ingestion.model.TankReading;
import com.fuelsight.ingestion.repository.ReadingRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Estimates daily consumption and days remaining for one tank from its recent
 * reading history.
 *
 * <p>Consecutive readings are compared pairwise. A pair whose level went up is a
 * refill and is left out, as is a pair with no elapsed time. The rate is the total
 * drop of the remaining pairs divided by their total elapsed time. Litre deltas are
 * used when every counted reading carries litres, otherwise the percent rate is
 * scaled by capacity.
 *
 * <p>At least {@value #MIN_DATA_POINTS} readings are required. Fewer yields
 * {@link ConsumptionEstimate.Status#INSUFFICIENT_DATA}, which callers must not
 * store over the vendor's figures.
 */
@Singleton
public class ConsumptionEstimator {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionEstimator.class);

    static final int MIN_DATA_POINTS = 3;

    private static final double SECONDS_PER_DAY = 86_400d;

    private final ReadingRepository readingRepository;
    private final Clock clock;
    private final int lookbackDays;
    private final double maxDaysRemaining;

    @Inject
    public ConsumptionEstimator(ReadingRepository readingRepository,
                                Clock clock,
                                @Value("${consumption.lookback-days:14}") int lookbackDays,
                                @Value("${consumption.max-days-remaining:365}") double maxDaysRemaining) {
        this.readingRepository = readingRepository;
        this.clock = clock;
        this.lookbackDays = lookbackDays;
        this.maxDaysRemaining = maxDaysRemaining;
    }

    /**
     * Loads the lookback window for the asset and estimates from it.
     *
     * @param assetId        asset whose readings are analysed
     * @param currentPercent current fill level in percent
     * @param capacityLiters tank capacity, may be {@code null}
     */
    public ConsumptionEstimate estimate(UUID assetId, double currentPercent, Double capacityLiters) {
        Instant since = clock.instant().minus(Duration.ofDays(lookbackDays));
        List<TankReading> readings = readingRepository.findSince(assetId, since);
        ConsumptionEstimate estimate = estimateFrom(readings, currentPercent, capacityLiters);
        log.debug("Consumption estimate assetId={} status={} dataPoints={} dailyLitres={} daysRemaining={}",
                assetId, estimate.status(), estimate.dataPoints(),
                estimate.dailyConsumptionLitres(), estimate.daysRemaining());
        return estimate;
    }

    /**
     * Pure estimate over readings sorted oldest first.
     */
    ConsumptionEstimate estimateFrom(List<TankReading> readings, double currentPercent, Double capacityLiters) {
        int dataPoints = readings.size();
        if (dataPoints < MIN_DATA_POINTS) {
            return ConsumptionEstimate.insufficientData(dataPoints);
        }

        double percentDrop = 0;
        double litreDrop = 0;
        double elapsedDays = 0;
        boolean litresComplete = true;
        int usablePairs = 0;

        for (int i = 1; i < readings.size(); i++) {
            TankReading previous = readings.get(i - 1);
            TankReading current = readings.get(i);
            double days = Duration.between(previous.getReadingAt(), current.getReadingAt()).getSeconds() / SECONDS_PER_DAY;
            double drop = previous.getLevelPercent() - current.getLevelPercent();
            if (days <= 0 || drop < 0) {
                continue;
            }
            usablePairs++;
            elapsedDays += days;
            percentDrop += drop;
            if (previous.getLevelLiters() != null && current.getLevelLiters() != null) {
                litreDrop += Math.max(0, previous.getLevelLiters() - current.getLevelLiters());
            } else {
                litresComplete = false;
            }
        }

        if (usablePairs == 0) {
            return ConsumptionEstimate.insufficientData(dataPoints);
        }

        ConsumptionConfidence confidence = confidence(dataPoints, spanDays(readings));
        double percentRate = percentDrop / elapsedDays;
        if (percentRate <= 0) {
            return new ConsumptionEstimate(ConsumptionEstimate.Status.NOT_CONSUMING, 0d, 0d, null, confidence, dataPoints);
        }

        boolean hasCapacity = capacityLiters != null && capacityLiters > 0;
        Double litreRate;
        if (litresComplete && litreDrop > 0) {
            litreRate = litreDrop / elapsedDays;
        } else if (hasCapacity) {
            litreRate = percentRate * capacityLiters / 100;
        } else {
            litreRate = null;
        }

        double daysRemaining = (litreRate != null && hasCapacity)
                ? (currentPercent / 100 * capacityLiters) / litreRate
                : currentPercent / percentRate;
        daysRemaining = Math.max(0, Math.min(maxDaysRemaining, daysRemaining));

        return new ConsumptionEstimate(
                ConsumptionEstimate.Status.ESTIMATED,
                litreRate != null ? round2(litreRate) : null,
                round2(percentRate),
                round2(daysRemaining),
                confidence,
                dataPoints);
    }

    static ConsumptionConfidence confidence(int dataPoints, double spanDays) {
        if (dataPoints >= 7 && spanDays >= 5) {
            return ConsumptionConfidence.HIGH;
        }
        if (dataPoints >= 5 && spanDays >= 2) {
            return ConsumptionConfidence.MEDIUM;
        }
        return ConsumptionConfidence.LOW;
    }

    private static double spanDays(List<TankReading> readings) {
        Instant first = readings.get(0).getReadingAt();
        Instant last = readings.get(readings.size() - 1).getReadingAt();
        return Duration.between(first, last).getSeconds() / SECONDS_PER_DAY;
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100d;
    }
}
