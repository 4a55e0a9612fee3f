package com.fuelsight.ingestion.model;

import java.util.UUID;

/**
 * Result of recording a single dip against a resolved tank.
 */
public record DipRecordResult(UUID tankId, UUID dipId, double levelPercent, int alertsCreated) {
}
