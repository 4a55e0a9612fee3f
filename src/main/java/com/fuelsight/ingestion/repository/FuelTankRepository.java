package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.FuelTank;
import com.fuelsight.ingestion.service.TankNameResolver;
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
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.fuelsight.ingestion.repository.JdbcSupport.*;

/**
 * JDBC-based repository for the {@code fuel_tanks} table, used by the manual dip path.
 */
@Singleton
public class FuelTankRepository implements TankNameResolver {

    private static final Logger log = LoggerFactory.getLogger(FuelTankRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public FuelTankRepository(DataSource dataSource,
                              @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    public Optional<FuelTank> findById(UUID id) {
        final String sql = """
                SELECT id, name, capacity_liters, current_level_liters, current_level_percent,
                       last_dip_at, updated_at
                  FROM fuel_tanks
                 WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(FuelTank.builder()
                            .id(getUuid(rs, "id"))
                            .name(rs.getString("name"))
                            .capacityLiters(getNullableDouble(rs, "capacity_liters"))
                            .currentLevelLiters(getNullableDouble(rs, "current_level_liters"))
                            .currentLevelPercent(getNullableDouble(rs, "current_level_percent"))
                            .lastDipAt(getInstant(rs, "last_dip_at"))
                            .updatedAt(getInstant(rs, "updated_at"))
                            .build());
                }
            }
        } catch (SQLException e) {
            log.error("Error in findById fuelTankId={}", id, e);
            throw new PersistenceException("DB error in fuel tank findById", e);
        }
        return Optional.empty();
    }

    /**
     * Case-insensitive, whitespace-trimmed name lookup. When several tanks share a
     * name the oldest one wins.
     */
    @Override
    public Optional<UUID> resolve(String tankName) {
        if (tankName == null || tankName.isBlank()) {
            return Optional.empty();
        }
        final String sql = """
                SELECT id
                  FROM fuel_tanks
                 WHERE LOWER(TRIM(name)) = LOWER(TRIM(?))
                 ORDER BY created_at ASC
                 LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setString(1, tankName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(getUuid(rs, "id"));
                }
            }
        } catch (SQLException e) {
            log.error("Error resolving fuel tank name={}", tankName, e);
            throw new PersistenceException("DB error in fuel tank name lookup", e);
        }
        return Optional.empty();
    }

    /**
     * Stores the level measured by a dip as the tank's current level.
     */
    public void updateCurrentLevel(UUID id, double levelLiters, Double levelPercent, Instant dipAt) {
        final String sql = """
                UPDATE fuel_tanks
                   SET current_level_liters  = ?,
                       current_level_percent = ?,
                       last_dip_at           = ?,
                       updated_at            = NOW()
                 WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setDouble(1, levelLiters);
            setNullableDouble(ps, 2, levelPercent);
            ps.setTimestamp(3, toTimestamp(dipAt));
            ps.setObject(4, id);

            int rows = ps.executeUpdate();
            log.info("Updated fuel_tanks current level fuelTankId={} levelLiters={} rows={}", id, levelLiters, rows);

        } catch (SQLException e) {
            log.error("Error updating fuel_tanks current level fuelTankId={}", id, e);
            throw new PersistenceException("DB error in updateCurrentLevel", e);
        }
    }
}
