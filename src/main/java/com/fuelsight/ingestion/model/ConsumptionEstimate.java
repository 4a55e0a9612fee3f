package com.fuelsight.ingestion.model;

/**
 * Result of {@link com.fuelsight.ingestion.service.ConsumptionEstimator#estimate}.
 *
 * Only an {@link Status#ESTIMATED} result may overwrite the consumption fields
 * reported by the vendor.
 */
public record ConsumptionEstimate(
        Status status,
        Double dailyConsumptionLitres,
        Double dailyConsumptionPercent,
        Double daysRemaining,
        ConsumptionConfidence confidence,
        int dataPoints
) {

    public enum Status {
        /** Positive consumption rate derived from enough history. */
        ESTIMATED,
        /** Fewer than the minimum number of readings, or no usable reading pair. */
        INSUFFICIENT_DATA,
        /** Enough history, but the level did not go down. */
        NOT_CONSUMING
    }

    public static ConsumptionEstimate insufficientData(int dataPoints) {
        return new ConsumptionEstimate(Status.INSUFFICIENT_DATA, null, null, null,
                ConsumptionConfidence.LOW, dataPoints);
    }

    public boolean isEstimated() {
        return status == Status.ESTIMATED;
    }
}
