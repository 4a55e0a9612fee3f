package com.fuelsight.ingestion;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the tank telemetry ingestion service.
 *
 * The service accepts Gasbot webhook pushes and manual dip readings, keeps the
 * current state of every monitored tank, records reading history, estimates
 * consumption and raises de-duplicated threshold alerts.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting TankTelemetryIngestion...");
        Micronaut.run(Application.class, args);
    }
}
