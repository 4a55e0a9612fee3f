package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.SyncLog;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static com.fuelsight.ingestion.repository.JdbcSupport.*;

/**
 * JDBC-based repository for the write-only {@code agbot_sync_logs} audit table.
 */
@Singleton
public class SyncLogRepository {

    private static final Logger log = LoggerFactory.getLogger(SyncLogRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public SyncLogRepository(DataSource dataSource,
                             @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    public SyncLog insert(SyncLog syncLog) {
        final String sql = """
                INSERT INTO agbot_sync_logs
                    (sync_type, sync_status, locations_processed, assets_processed, readings_processed,
                     alerts_created, error_message, sync_duration_ms, started_at, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setString(1, syncLog.getSyncType());
            ps.setString(2, syncLog.getSyncStatus());
            ps.setInt(3, syncLog.getLocationsProcessed());
            ps.setInt(4, syncLog.getAssetsProcessed());
            ps.setInt(5, syncLog.getReadingsProcessed());
            ps.setInt(6, syncLog.getAlertsCreated());
            setNullableString(ps, 7, syncLog.getErrorMessage());
            ps.setLong(8, syncLog.getSyncDurationMs());
            ps.setTimestamp(9, toTimestamp(syncLog.getStartedAt()));
            ps.setTimestamp(10, toTimestamp(syncLog.getCompletedAt()));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    syncLog.setId(getUuid(rs, "id"));
                }
            }

            log.info("Saved agbot_sync_logs id={} type={} status={}",
                    syncLog.getId(), syncLog.getSyncType(), syncLog.getSyncStatus());
            return syncLog;

        } catch (SQLException e) {
            log.error("Error saving agbot_sync_logs type={} status={}", syncLog.getSyncType(), syncLog.getSyncStatus(), e);
            throw new PersistenceException("DB error in sync log insert", e);
        }
    }
}
