package com.fuelsight.ingestion.model;

/**
 * Confidence grade attached to a consumption estimate.
 *
 * <ul>
 *   <li>HIGH   - at least 7 readings spanning at least 5 days</li>
 *   <li>MEDIUM - at least 5 readings spanning at least 2 days</li>
 *   <li>LOW    - anything less</li>
 * </ul>
 */
public enum ConsumptionConfidence {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    ConsumptionConfidence(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
