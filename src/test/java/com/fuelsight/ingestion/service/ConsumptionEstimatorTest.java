package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.ConsumptionConfidence;
import com.fuelsight.ingestion.model.ConsumptionEstimate;
import com.fuelsight.ingestion.model.TankReading;
import com.fuelsight.ingestion.repository.ReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsumptionEstimatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @Mock
    private ReadingRepository readingRepository;

    private ConsumptionEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new ConsumptionEstimator(readingRepository, Clock.fixed(NOW, ZoneOffset.UTC), 14, 365);
    }

    private static TankReading reading(int daysAgo, double percent, Double litres) {
        return TankReading.builder()
                .levelPercent(percent)
                .levelLiters(litres)
                .readingAt(NOW.minus(Duration.ofDays(daysAgo)))
                .build();
    }

    @Test
    @DisplayName("fewer than three readings is insufficient data")
    void insufficientData() {
        ConsumptionEstimate estimate = estimator.estimateFrom(
                List.of(reading(2, 60, null), reading(1, 50, null)), 50, 1000d);

        assertThat(estimate.status()).isEqualTo(ConsumptionEstimate.Status.INSUFFICIENT_DATA);
        assertThat(estimate.isEstimated()).isFalse();
        assertThat(estimate.daysRemaining()).isNull();
        assertThat(estimate.dataPoints()).isEqualTo(2);
    }

    @Test
    @DisplayName("steady decline with litres gives a litre rate and high confidence")
    void steadyDeclineWithLitres() {
        // Arrange: 8 daily readings, 2% (100 L) per day on a 5000 L tank
        List<TankReading> readings = new ArrayList<>();
        for (int day = 7; day >= 0; day--) {
            double percent = 80 - 2 * (7 - day);
            readings.add(reading(day, percent, percent * 50));
        }

        // Act
        ConsumptionEstimate estimate = estimator.estimateFrom(readings, 68, 5000d);

        // Assert
        assertThat(estimate.status()).isEqualTo(ConsumptionEstimate.Status.ESTIMATED);
        assertThat(estimate.dailyConsumptionLitres()).isEqualTo(100.0);
        assertThat(estimate.dailyConsumptionPercent()).isEqualTo(2.0);
        assertThat(estimate.daysRemaining()).isEqualTo(34.0);
        assertThat(estimate.confidence()).isEqualTo(ConsumptionConfidence.HIGH);
        assertThat(estimate.dataPoints()).isEqualTo(8);
    }

    @Test
    @DisplayName("refill pairs are excluded from the rate")
    void excludesRefill() {
        List<TankReading> readings = List.of(
                reading(3, 50, null),
                reading(2, 45, null),
                reading(1, 90, null),
                reading(0, 85, null));

        ConsumptionEstimate estimate = estimator.estimateFrom(readings, 85, null);

        assertThat(estimate.status()).isEqualTo(ConsumptionEstimate.Status.ESTIMATED);
        assertThat(estimate.dailyConsumptionPercent()).isEqualTo(5.0);
        assertThat(estimate.dailyConsumptionLitres()).isNull();
        assertThat(estimate.daysRemaining()).isEqualTo(17.0);
        assertThat(estimate.confidence()).isEqualTo(ConsumptionConfidence.LOW);
    }

    @Test
    @DisplayName("percent rate is scaled by capacity when litres are missing")
    void scalesPercentRateByCapacity() {
        List<TankReading> readings = List.of(
                reading(2, 50, null),
                reading(1, 46, 2300d),
                reading(0, 42, 2100d));

        ConsumptionEstimate estimate = estimator.estimateFrom(readings, 42, 5000d);

        assertThat(estimate.dailyConsumptionLitres()).isEqualTo(200.0);
        assertThat(estimate.daysRemaining()).isEqualTo(10.5);
    }

    @Test
    @DisplayName("a flat level is reported as not consuming")
    void flatLevelIsNotConsuming() {
        List<TankReading> readings = List.of(reading(2, 50, null), reading(1, 50, null), reading(0, 50, null));

        ConsumptionEstimate estimate = estimator.estimateFrom(readings, 50, 1000d);

        assertThat(estimate.status()).isEqualTo(ConsumptionEstimate.Status.NOT_CONSUMING);
        assertThat(estimate.dailyConsumptionLitres()).isZero();
        assertThat(estimate.daysRemaining()).isNull();
    }

    @Test
    @DisplayName("only rising levels leave no usable pair")
    void onlyRefillsIsInsufficient() {
        List<TankReading> readings = List.of(reading(2, 10, null), reading(1, 50, null), reading(0, 90, null));

        assertThat(estimator.estimateFrom(readings, 90, null).status())
                .isEqualTo(ConsumptionEstimate.Status.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("days remaining is capped at the configured maximum")
    void capsDaysRemaining() {
        List<TankReading> readings = List.of(reading(2, 50, null), reading(1, 49.99, null), reading(0, 49.98, null));

        ConsumptionEstimate estimate = estimator.estimateFrom(readings, 49.98, null);

        assertThat(estimate.daysRemaining()).isEqualTo(365.0);
    }

    @Test
    @DisplayName("estimate loads the lookback window from the repository")
    void loadsLookbackWindow() {
        UUID assetId = UUID.randomUUID();
        when(readingRepository.findSince(assetId, NOW.minus(Duration.ofDays(14))))
                .thenReturn(List.of(reading(1, 60, null)));

        ConsumptionEstimate estimate = estimator.estimate(assetId, 60, null);

        assertThat(estimate.status()).isEqualTo(ConsumptionEstimate.Status.INSUFFICIENT_DATA);
        verify(readingRepository).findSince(assetId, NOW.minus(Duration.ofDays(14)));
    }

    @Test
    @DisplayName("confidence tiers depend on points and span")
    void confidenceTiers() {
        assertThat(ConsumptionEstimator.confidence(7, 5)).isEqualTo(ConsumptionConfidence.HIGH);
        assertThat(ConsumptionEstimator.confidence(7, 4.9)).isEqualTo(ConsumptionConfidence.MEDIUM);
        assertThat(ConsumptionEstimator.confidence(5, 2)).isEqualTo(ConsumptionConfidence.MEDIUM);
        assertThat(ConsumptionEstimator.confidence(4, 10)).isEqualTo(ConsumptionConfidence.LOW);
    }
}
