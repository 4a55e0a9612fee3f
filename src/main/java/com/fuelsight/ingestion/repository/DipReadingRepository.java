package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.DipReading;
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
 * JDBC-based repository for the append-only {@code dip_readings} table.
 */
@Singleton
public class DipReadingRepository {

    private static final Logger log = LoggerFactory.getLogger(DipReadingRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public DipReadingRepository(DataSource dataSource,
                                @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    public DipReading insert(DipReading dip) {
        final String sql = """
                INSERT INTO dip_readings
                    (tank_id, value_liters, level_percent, recorded_at, recorded_by, created_at)
                VALUES (?, ?, ?, ?, ?, NOW())
                RETURNING id, created_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, dip.getTankId());
            ps.setDouble(2, dip.getValueLiters());
            setNullableDouble(ps, 3, dip.getLevelPercent());
            ps.setTimestamp(4, toTimestamp(dip.getRecordedAt()));
            setNullableString(ps, 5, dip.getRecordedBy());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    dip.setId(getUuid(rs, "id"));
                    dip.setCreatedAt(getInstant(rs, "created_at"));
                }
            }

            log.info("Saved dip_readings id={} fuelTankId={} valueLiters={}", dip.getId(), dip.getTankId(), dip.getValueLiters());
            return dip;

        } catch (SQLException e) {
            log.error("Error saving dip_readings fuelTankId={}", dip.getTankId(), e);
            throw new PersistenceException("DB error in dip insert", e);
        }
    }
}
