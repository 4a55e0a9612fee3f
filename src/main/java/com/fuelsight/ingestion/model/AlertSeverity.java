package com.fuelsight.ingestion.model;

public enum AlertSeverity {

    WARNING("warning"),
    CRITICAL("critical");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
