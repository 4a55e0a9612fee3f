package com.fuelsight.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code agbot_sync_logs} audit table.
 *
 * Exactly one row is written per ingestion execution, including executions that
 * failed before any record was processed. The pipeline never reads these rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncLog {

    private UUID id;

    /** Source of the execution, e.g. {@code gasbot_webhook} or {@code manual_dip}. */
    private String syncType;

    /** One of the {@link SyncStatus} codes. */
    private String syncStatus;

    private int locationsProcessed;

    private int assetsProcessed;

    private int readingsProcessed;

    private int alertsCreated;

    /** First few error messages joined with {@code "; "}, truncated. */
    private String errorMessage;

    private long syncDurationMs;

    private Instant startedAt;

    private Instant completedAt;
}
