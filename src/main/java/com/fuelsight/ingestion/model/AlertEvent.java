package com.fuelsight.ingestion.model;

import java.util.UUID;

/**
 * A threshold condition detected for one asset, not yet persisted.
 *
 * Produced by {@link com.fuelsight.ingestion.service.AlertEngine#evaluate} and turned
 * into a {@link TankAlert} row only if no active alert of the same type exists.
 */
public record AlertEvent(
        UUID assetId,
        AlertType type,
        AlertSeverity severity,
        String message,
        Double currentValue,
        Double thresholdValue,
        Double previousValue
) {

    public TankAlert toAlert() {
        return TankAlert.builder()
                .assetId(assetId)
                .alertType(type.code())
                .severity(severity.code())
                .message(message)
                .currentValue(currentValue)
                .thresholdValue(thresholdValue)
                .previousValue(previousValue)
                .active(true)
                .build();
    }
}
