package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.TankReading;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.fuelsight.ingestion.repository.JdbcSupport.*;

/**
 * JDBC-based repository for the append-only {@code agbot_readings_history} table.
 *
 * There is no update or upsert: every webhook delivery appends a new row.
 */
@Singleton
public class ReadingRepository {

    private static final Logger log = LoggerFactory.getLogger(ReadingRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public ReadingRepository(DataSource dataSource,
                             @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    /**
     * Appends a reading.
     *
     * @param reading the reading to persist (id is set on return)
     * @return the saved reading
     */
    public TankReading insert(TankReading reading) {
        final String sql = """
                INSERT INTO agbot_readings_history
                    (asset_id, level_liters, level_percent, raw_percent, depth_m, pressure, pressure_bar,
                     is_online, battery_voltage, temperature_c, device_state,
                     daily_consumption, days_remaining, reading_at, telemetry_epoch, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
                RETURNING id, created_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, reading.getAssetId());
            setNullableDouble(ps, 2, reading.getLevelLiters());
            ps.setDouble(3, reading.getLevelPercent());
            ps.setDouble(4, reading.getRawPercent());
            setNullableDouble(ps, 5, reading.getDepthM());
            setNullableDouble(ps, 6, reading.getPressure());
            setNullableDouble(ps, 7, reading.getPressureBar());
            ps.setBoolean(8, reading.isOnline());
            setNullableDouble(ps, 9, reading.getBatteryVoltage());
            setNullableDouble(ps, 10, reading.getTemperatureC());
            setNullableString(ps, 11, reading.getDeviceState());
            setNullableDouble(ps, 12, reading.getDailyConsumption());
            setNullableInteger(ps, 13, reading.getDaysRemaining());
            ps.setTimestamp(14, toTimestamp(reading.getReadingAt()));
            setNullableLong(ps, 15, reading.getTelemetryEpoch());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    reading.setId(getUuid(rs, "id"));
                    reading.setCreatedAt(getInstant(rs, "created_at"));
                }
            }
            return reading;

        } catch (SQLException e) {
            log.error("Error inserting agbot_readings_history assetId={}", reading.getAssetId(), e);
            throw new PersistenceException("DB error in reading insert", e);
        }
    }

    /**
     * Returns the readings of one asset taken at or after {@code since}, oldest first.
     *
     * @param assetId asset to query
     * @param since   lower bound of the lookback window
     */
    public List<TankReading> findSince(UUID assetId, Instant since) {
        final String sql = """
                SELECT id, asset_id, level_liters, level_percent, raw_percent, depth_m, pressure, pressure_bar,
                       is_online, battery_voltage, temperature_c, device_state,
                       daily_consumption, days_remaining, reading_at, telemetry_epoch, created_at
                  FROM agbot_readings_history
                 WHERE asset_id = ?
                   AND reading_at >= ?
                 ORDER BY reading_at ASC
                """;

        List<TankReading> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setObject(1, assetId);
            ps.setTimestamp(2, toTimestamp(since));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findSince assetId={} since={}", assetId, since, e);
            throw new PersistenceException("DB error in findSince", e);
        }
        return result;
    }

    private TankReading mapRow(ResultSet rs) throws SQLException {
        return TankReading.builder()
                .id(getUuid(rs, "id"))
                .assetId(getUuid(rs, "asset_id"))
                .levelLiters(getNullableDouble(rs, "level_liters"))
                .levelPercent(rs.getDouble("level_percent"))
                .rawPercent(rs.getDouble("raw_percent"))
                .depthM(getNullableDouble(rs, "depth_m"))
                .pressure(getNullableDouble(rs, "pressure"))
                .pressureBar(getNullableDouble(rs, "pressure_bar"))
                .online(rs.getBoolean("is_online"))
                .batteryVoltage(getNullableDouble(rs, "battery_voltage"))
                .temperatureC(getNullableDouble(rs, "temperature_c"))
                .deviceState(rs.getString("device_state"))
                .dailyConsumption(getNullableDouble(rs, "daily_consumption"))
                .daysRemaining(getNullableInteger(rs, "days_remaining"))
                .readingAt(getInstant(rs, "reading_at"))
                .telemetryEpoch(getNullableLong(rs, "telemetry_epoch"))
                .createdAt(getInstant(rs, "created_at"))
                .build();
    }
}
