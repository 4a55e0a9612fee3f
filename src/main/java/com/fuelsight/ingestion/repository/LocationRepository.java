package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.TankLocation;
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
 * JDBC-based repository for the {@code agbot_locations} table.
 *
 * {@code external_guid} is the conflict key: the latest payload always overwrites the
 * current-state columns of an existing row, and {@code created_at} is kept.
 */
@Singleton
public class LocationRepository {

    private static final Logger log = LoggerFactory.getLogger(LocationRepository.class);

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public LocationRepository(DataSource dataSource,
                              @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    /**
     * Inserts the location or updates the existing row with the same {@code external_guid}.
     *
     * @param location transformed location (id and timestamps are set on return)
     * @return the same instance carrying the database id
     */
    public TankLocation upsert(TankLocation location) {
        final String sql = """
                INSERT INTO agbot_locations
                    (external_guid, name, customer_name, customer_guid, tenancy_name,
                     address, state, postcode, country, latitude, longitude,
                     installation_status, installation_status_label, is_disabled,
                     daily_consumption_liters, days_remaining, calibrated_fill_level,
                     last_telemetry_at, last_telemetry_epoch, raw_data,
                     created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, NOW(), NOW())
                ON CONFLICT (external_guid) DO UPDATE SET
                    name                      = EXCLUDED.name,
                    customer_name             = EXCLUDED.customer_name,
                    customer_guid             = EXCLUDED.customer_guid,
                    tenancy_name              = EXCLUDED.tenancy_name,
                    address                   = EXCLUDED.address,
                    state                     = EXCLUDED.state,
                    postcode                  = EXCLUDED.postcode,
                    country                   = EXCLUDED.country,
                    latitude                  = EXCLUDED.latitude,
                    longitude                 = EXCLUDED.longitude,
                    installation_status       = EXCLUDED.installation_status,
                    installation_status_label = EXCLUDED.installation_status_label,
                    is_disabled               = EXCLUDED.is_disabled,
                    daily_consumption_liters  = EXCLUDED.daily_consumption_liters,
                    days_remaining            = EXCLUDED.days_remaining,
                    calibrated_fill_level     = EXCLUDED.calibrated_fill_level,
                    last_telemetry_at         = EXCLUDED.last_telemetry_at,
                    last_telemetry_epoch      = EXCLUDED.last_telemetry_epoch,
                    raw_data                  = EXCLUDED.raw_data,
                    updated_at                = NOW()
                RETURNING id, created_at, updated_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setString(1, location.getExternalGuid());
            ps.setString(2, location.getName());
            setNullableString(ps, 3, location.getCustomerName());
            setNullableString(ps, 4, location.getCustomerGuid());
            setNullableString(ps, 5, location.getTenancyName());
            setNullableString(ps, 6, location.getAddress());
            setNullableString(ps, 7, location.getState());
            setNullableString(ps, 8, location.getPostcode());
            setNullableString(ps, 9, location.getCountry());
            setNullableDouble(ps, 10, location.getLatitude());
            setNullableDouble(ps, 11, location.getLongitude());
            setNullableInteger(ps, 12, location.getInstallationStatus());
            setNullableString(ps, 13, location.getInstallationStatusLabel());
            ps.setBoolean(14, location.isDisabled());
            setNullableDouble(ps, 15, location.getDailyConsumptionLiters());
            setNullableInteger(ps, 16, location.getDaysRemaining());
            setNullableDouble(ps, 17, location.getCalibratedFillLevel());
            setNullableTimestamp(ps, 18, location.getLastTelemetryAt());
            setNullableLong(ps, 19, location.getLastTelemetryEpoch());
            setNullableString(ps, 20, location.getRawData());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    location.setId(getUuid(rs, "id"));
                    location.setCreatedAt(getInstant(rs, "created_at"));
                    location.setUpdatedAt(getInstant(rs, "updated_at"));
                }
            }

            log.debug("Upserted agbot_locations id={} externalGuid={}", location.getId(), location.getExternalGuid());
            return location;

        } catch (SQLException e) {
            log.error("Error upserting agbot_locations externalGuid={}", location.getExternalGuid(), e);
            throw new PersistenceException("DB error in location upsert", e);
        }
    }
}
