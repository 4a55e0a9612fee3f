package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.TankAlert;
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
import java.util.Optional;
import java.util.UUID;

import static com.fuelsight.ingestion.repository.JdbcSupport.*;

/**
 * JDBC-based repository for the {@code tank_alerts} table.
 *
 * The table has a partial unique index on {@code (asset_id, alert_type) WHERE is_active}.
 * {@link #insertIfAbsent} relies on it, so two concurrent deliveries that both miss
 * the {@link #findActive} check still produce a single active alert.
 */
@Singleton
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public AlertRepository(DataSource dataSource,
                           @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    /**
     * Finds the active alert of the given type for an asset.
     *
     * @param assetId   asset (or fuel tank) id
     * @param alertType alert type code
     */
    public Optional<TankAlert> findActive(UUID assetId, String alertType) {
        final String sql = """
                SELECT id, asset_id, alert_type, severity, message,
                       current_value, threshold_value, previous_value, is_active, created_at
                  FROM tank_alerts
                 WHERE asset_id = ?
                   AND alert_type = ?
                   AND is_active = TRUE
                 LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, assetId);
            ps.setString(2, alertType);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findActive assetId={} alertType={}", assetId, alertType, e);
            throw new PersistenceException("DB error in findActive", e);
        }
        return Optional.empty();
    }

    /**
     * Inserts an active alert unless one of the same type is already active.
     *
     * @param alert alert to insert (id and createdAt are set when inserted)
     * @return {@code true} if a row was inserted, {@code false} if an active alert already existed
     */
    public boolean insertIfAbsent(TankAlert alert) {
        final String sql = """
                INSERT INTO tank_alerts
                    (asset_id, alert_type, severity, message,
                     current_value, threshold_value, previous_value, is_active, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, TRUE, NOW())
                ON CONFLICT (asset_id, alert_type) WHERE is_active DO NOTHING
                RETURNING id, created_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, alert.getAssetId());
            ps.setString(2, alert.getAlertType());
            ps.setString(3, alert.getSeverity());
            setNullableString(ps, 4, alert.getMessage());
            setNullableDouble(ps, 5, alert.getCurrentValue());
            setNullableDouble(ps, 6, alert.getThresholdValue());
            setNullableDouble(ps, 7, alert.getPreviousValue());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    alert.setId(getUuid(rs, "id"));
                    alert.setCreatedAt(getInstant(rs, "created_at"));
                    alert.setActive(true);
                    return true;
                }
            }
            log.info("Active alert already present assetId={} alertType={}", alert.getAssetId(), alert.getAlertType());
            return false;

        } catch (SQLException e) {
            log.error("Error inserting tank_alerts assetId={} alertType={}", alert.getAssetId(), alert.getAlertType(), e);
            throw new PersistenceException("DB error in alert insert", e);
        }
    }

    private TankAlert mapRow(ResultSet rs) throws SQLException {
        return TankAlert.builder()
                .id(getUuid(rs, "id"))
                .assetId(getUuid(rs, "asset_id"))
                .alertType(rs.getString("alert_type"))
                .severity(rs.getString("severity"))
                .message(rs.getString("message"))
                .currentValue(getNullableDouble(rs, "current_value"))
                .thresholdValue(getNullableDouble(rs, "threshold_value"))
                .previousValue(getNullableDouble(rs, "previous_value"))
                .active(rs.getBoolean("is_active"))
                .createdAt(getInstant(rs, "created_at"))
                .build();
    }
}
