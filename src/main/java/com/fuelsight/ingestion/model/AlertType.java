package com.fuelsight.ingestion.model;

/**
 * Alert types raised by the ingestion pipeline.
 *
 * <ul>
 *   <li>LOW_BATTERY    - device battery voltage below threshold</li>
 *   <li>LOW_FUEL       - days remaining or fill level at the warning tier</li>
 *   <li>CRITICAL_FUEL  - days remaining or fill level at the critical tier</li>
 *   <li>DEVICE_OFFLINE - device went from online to offline</li>
 *   <li>DIP_LOW        - manual dip at or below the low tier</li>
 *   <li>DIP_CRITICAL   - manual dip at or below the critical tier</li>
 * </ul>
 */
public enum AlertType {

    LOW_BATTERY("low_battery"),
    LOW_FUEL("low_fuel"),
    CRITICAL_FUEL("critical"),
    DEVICE_OFFLINE("device_offline"),
    DIP_LOW("dip_low"),
    DIP_CRITICAL("dip_critical");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    /** Value stored in {@code tank_alerts.alert_type}. */
    public String code() {
        return code;
    }
}
