package com.fuelsight.ingestion.repository;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.ConsumptionEstimate;
import com.fuelsight.ingestion.model.TankAsset;
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
import java.util.Optional;
import java.util.UUID;

import static com.fuelsight.ingestion.repository.JdbcSupport.*;

/**
 * JDBC-based repository for the {@code agbot_assets} table.
 *
 * Upserts are keyed on {@code external_guid}. The consumption-calculation columns
 * ({@code last_consumption_calc_at}, {@code consumption_calc_confidence}) are only
 * written by {@link #updateConsumption}, never by the webhook upsert.
 */
@Singleton
public class AssetRepository {

    private static final Logger log = LoggerFactory.getLogger(AssetRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT a.id, a.location_id, a.external_guid, a.name, a.serial_number,
                   a.profile_name, a.profile_guid, a.commodity,
                   a.capacity_liters, a.max_depth_m, a.max_pressure, a.max_pressure_bar, a.max_display_percent,
                   a.current_level_liters, a.current_level_percent, a.current_raw_percent,
                   a.current_depth_m, a.current_pressure, a.current_pressure_bar, a.ullage_liters,
                   a.daily_consumption_liters, a.days_remaining,
                   a.last_consumption_calc_at, a.consumption_calc_confidence,
                   a.device_guid, a.device_serial, a.device_model, a.device_model_name,
                   a.device_sku, a.device_network_id, a.helmet_serial,
                   a.is_online, a.is_disabled, a.device_state, a.battery_voltage, a.temperature_c,
                   a.device_activated_at, a.device_activation_epoch,
                   a.last_telemetry_at, a.last_telemetry_epoch,
                   a.last_raw_telemetry_at, a.last_raw_telemetry_epoch,
                   a.last_calibrated_telemetry_at, a.last_calibrated_telemetry_epoch,
                   a.asset_updated_at, a.asset_updated_epoch,
                   a.created_at, a.updated_at
            """;

    private final DataSource dataSource;
    private final int statementTimeoutSeconds;

    @Inject
    public AssetRepository(DataSource dataSource,
                           @Value("${ingestion.statement-timeout-seconds:5}") int statementTimeoutSeconds) {
        this.dataSource = dataSource;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    // -----------------------------------------------------------------------
    // Read operations
    // -----------------------------------------------------------------------

    /**
     * Loads the stored state of an asset before it is overwritten, so the alert
     * engine can compare previous and current values.
     *
     * @param externalGuid vendor or derived asset GUID
     * @return the asset if it has been seen before
     */
    public Optional<TankAsset> findByExternalGuid(String externalGuid) {
        final String sql = SELECT_COLUMNS + """
                  FROM agbot_assets a
                 WHERE a.external_guid = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setString(1, externalGuid);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findByExternalGuid externalGuid={}", externalGuid, e);
            throw new PersistenceException("DB error in findByExternalGuid", e);
        }
        return Optional.empty();
    }

    /**
     * Returns enabled assets at enabled locations, least recently recalculated first.
     *
     * @param limit maximum number of rows to return
     */
    public List<TankAsset> findActiveForRecalculation(int limit) {
        final String sql = SELECT_COLUMNS + """
                  FROM agbot_assets a
                  JOIN agbot_locations l ON l.id = a.location_id
                 WHERE a.is_disabled = FALSE
                   AND l.is_disabled = FALSE
                 ORDER BY a.last_consumption_calc_at ASC NULLS FIRST
                 LIMIT ?
                """;

        List<TankAsset> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findActiveForRecalculation limit={}", limit, e);
            throw new PersistenceException("DB error in findActiveForRecalculation", e);
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // Write operations
    // -----------------------------------------------------------------------

    /**
     * Inserts the asset or overwrites the current-state columns of the existing row
     * with the same {@code external_guid}.
     *
     * @param asset transformed asset (id and timestamps are set on return)
     * @return the same instance carrying the database id
     */
    public TankAsset upsert(TankAsset asset) {
        final String sql = """
                INSERT INTO agbot_assets
                    (location_id, external_guid, name, serial_number, profile_name, profile_guid, commodity,
                     capacity_liters, max_depth_m, max_pressure, max_pressure_bar, max_display_percent,
                     current_level_liters, current_level_percent, current_raw_percent,
                     current_depth_m, current_pressure, current_pressure_bar, ullage_liters,
                     daily_consumption_liters, days_remaining,
                     device_guid, device_serial, device_model, device_model_name,
                     device_sku, device_network_id, helmet_serial,
                     is_online, is_disabled, device_state, battery_voltage, temperature_c,
                     device_activated_at, device_activation_epoch,
                     last_telemetry_at, last_telemetry_epoch,
                     last_raw_telemetry_at, last_raw_telemetry_epoch,
                     last_calibrated_telemetry_at, last_calibrated_telemetry_epoch,
                     asset_updated_at, asset_updated_epoch, raw_data,
                     created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?,
                        ?, ?, ?, ?, ?,
                        ?, ?, ?,
                        ?, ?, ?, ?,
                        ?, ?,
                        ?, ?, ?, ?,
                        ?, ?, ?,
                        ?, ?, ?, ?, ?,
                        ?, ?,
                        ?, ?,
                        ?, ?,
                        ?, ?,
                        ?, ?, ?::jsonb,
                        NOW(), NOW())
                ON CONFLICT (external_guid) DO UPDATE SET
                    location_id                     = EXCLUDED.location_id,
                    name                            = EXCLUDED.name,
                    serial_number                   = EXCLUDED.serial_number,
                    profile_name                    = EXCLUDED.profile_name,
                    profile_guid                    = EXCLUDED.profile_guid,
                    commodity                       = EXCLUDED.commodity,
                    capacity_liters                 = EXCLUDED.capacity_liters,
                    max_depth_m                     = EXCLUDED.max_depth_m,
                    max_pressure                    = EXCLUDED.max_pressure,
                    max_pressure_bar                = EXCLUDED.max_pressure_bar,
                    max_display_percent             = EXCLUDED.max_display_percent,
                    current_level_liters            = EXCLUDED.current_level_liters,
                    current_level_percent           = EXCLUDED.current_level_percent,
                    current_raw_percent             = EXCLUDED.current_raw_percent,
                    current_depth_m                 = EXCLUDED.current_depth_m,
                    current_pressure                = EXCLUDED.current_pressure,
                    current_pressure_bar            = EXCLUDED.current_pressure_bar,
                    ullage_liters                   = EXCLUDED.ullage_liters,
                    daily_consumption_liters        = EXCLUDED.daily_consumption_liters,
                    days_remaining                  = EXCLUDED.days_remaining,
                    device_guid                     = EXCLUDED.device_guid,
                    device_serial                   = EXCLUDED.device_serial,
                    device_model                    = EXCLUDED.device_model,
                    device_model_name               = EXCLUDED.device_model_name,
                    device_sku                      = EXCLUDED.device_sku,
                    device_network_id               = EXCLUDED.device_network_id,
                    helmet_serial                   = EXCLUDED.helmet_serial,
                    is_online                       = EXCLUDED.is_online,
                    is_disabled                     = EXCLUDED.is_disabled,
                    device_state                    = EXCLUDED.device_state,
                    battery_voltage                 = EXCLUDED.battery_voltage,
                    temperature_c                   = EXCLUDED.temperature_c,
                    device_activated_at             = EXCLUDED.device_activated_at,
                    device_activation_epoch         = EXCLUDED.device_activation_epoch,
                    last_telemetry_at               = EXCLUDED.last_telemetry_at,
                    last_telemetry_epoch            = EXCLUDED.last_telemetry_epoch,
                    last_raw_telemetry_at           = EXCLUDED.last_raw_telemetry_at,
                    last_raw_telemetry_epoch        = EXCLUDED.last_raw_telemetry_epoch,
                    last_calibrated_telemetry_at    = EXCLUDED.last_calibrated_telemetry_at,
                    last_calibrated_telemetry_epoch = EXCLUDED.last_calibrated_telemetry_epoch,
                    asset_updated_at                = EXCLUDED.asset_updated_at,
                    asset_updated_epoch             = EXCLUDED.asset_updated_epoch,
                    raw_data                        = EXCLUDED.raw_data,
                    updated_at                      = NOW()
                RETURNING id, created_at, updated_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            int i = 1;
            ps.setObject(i++, asset.getLocationId());
            ps.setString(i++, asset.getExternalGuid());
            setNullableString(ps, i++, asset.getName());
            setNullableString(ps, i++, asset.getSerialNumber());
            setNullableString(ps, i++, asset.getProfileName());
            setNullableString(ps, i++, asset.getProfileGuid());
            setNullableString(ps, i++, asset.getCommodity());
            setNullableDouble(ps, i++, asset.getCapacityLiters());
            setNullableDouble(ps, i++, asset.getMaxDepthM());
            setNullableDouble(ps, i++, asset.getMaxPressure());
            setNullableDouble(ps, i++, asset.getMaxPressureBar());
            setNullableDouble(ps, i++, asset.getMaxDisplayPercent());
            setNullableDouble(ps, i++, asset.getCurrentLevelLiters());
            ps.setDouble(i++, asset.getCurrentLevelPercent());
            ps.setDouble(i++, asset.getCurrentRawPercent());
            setNullableDouble(ps, i++, asset.getCurrentDepthM());
            setNullableDouble(ps, i++, asset.getCurrentPressure());
            setNullableDouble(ps, i++, asset.getCurrentPressureBar());
            setNullableDouble(ps, i++, asset.getUllageLiters());
            setNullableDouble(ps, i++, asset.getDailyConsumptionLiters());
            setNullableDouble(ps, i++, asset.getDaysRemaining());
            setNullableString(ps, i++, asset.getDeviceGuid());
            setNullableString(ps, i++, asset.getDeviceSerial());
            setNullableInteger(ps, i++, asset.getDeviceModel());
            setNullableString(ps, i++, asset.getDeviceModelName());
            setNullableString(ps, i++, asset.getDeviceSku());
            setNullableString(ps, i++, asset.getDeviceNetworkId());
            setNullableString(ps, i++, asset.getHelmetSerial());
            ps.setBoolean(i++, asset.isOnline());
            ps.setBoolean(i++, asset.isDisabled());
            setNullableString(ps, i++, asset.getDeviceState());
            setNullableDouble(ps, i++, asset.getBatteryVoltage());
            setNullableDouble(ps, i++, asset.getTemperatureC());
            setNullableTimestamp(ps, i++, asset.getDeviceActivatedAt());
            setNullableLong(ps, i++, asset.getDeviceActivationEpoch());
            setNullableTimestamp(ps, i++, asset.getLastTelemetryAt());
            setNullableLong(ps, i++, asset.getLastTelemetryEpoch());
            setNullableTimestamp(ps, i++, asset.getLastRawTelemetryAt());
            setNullableLong(ps, i++, asset.getLastRawTelemetryEpoch());
            setNullableTimestamp(ps, i++, asset.getLastCalibratedTelemetryAt());
            setNullableLong(ps, i++, asset.getLastCalibratedTelemetryEpoch());
            setNullableTimestamp(ps, i++, asset.getAssetUpdatedAt());
            setNullableLong(ps, i++, asset.getAssetUpdatedEpoch());
            setNullableString(ps, i, asset.getRawData());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    asset.setId(getUuid(rs, "id"));
                    asset.setCreatedAt(getInstant(rs, "created_at"));
                    asset.setUpdatedAt(getInstant(rs, "updated_at"));
                }
            }

            log.debug("Upserted agbot_assets id={} externalGuid={}", asset.getId(), asset.getExternalGuid());
            return asset;

        } catch (SQLException e) {
            log.error("Error upserting agbot_assets externalGuid={}", asset.getExternalGuid(), e);
            throw new PersistenceException("DB error in asset upsert", e);
        }
    }

    /**
     * Overwrites the consumption analytics of an asset with a calculated estimate.
     * Callers pass only {@link ConsumptionEstimate.Status#ESTIMATED} results.
     *
     * @param assetId      asset to update
     * @param estimate     the estimate to store
     * @param calculatedAt time of calculation
     */
    public void updateConsumption(UUID assetId, ConsumptionEstimate estimate, Instant calculatedAt) {
        final String sql = """
                UPDATE agbot_assets
                   SET daily_consumption_liters    = ?,
                       days_remaining              = ?,
                       last_consumption_calc_at    = ?,
                       consumption_calc_confidence = ?,
                       updated_at                  = NOW()
                 WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(statementTimeoutSeconds);
            setNullableDouble(ps, 1, estimate.dailyConsumptionLitres());
            setNullableDouble(ps, 2, estimate.daysRemaining());
            ps.setTimestamp(3, toTimestamp(calculatedAt));
            ps.setString(4, estimate.confidence().code());
            ps.setObject(5, assetId);

            int rows = ps.executeUpdate();
            log.debug("Updated consumption assetId={} rows={}", assetId, rows);

        } catch (SQLException e) {
            log.error("Error updating consumption assetId={}", assetId, e);
            throw new PersistenceException("DB error in updateConsumption", e);
        }
    }

    // -----------------------------------------------------------------------
    // Row mapping
    // -----------------------------------------------------------------------

    private TankAsset mapRow(ResultSet rs) throws SQLException {
        return TankAsset.builder()
                .id(getUuid(rs, "id"))
                .locationId(getUuid(rs, "location_id"))
                .externalGuid(rs.getString("external_guid"))
                .name(rs.getString("name"))
                .serialNumber(rs.getString("serial_number"))
                .profileName(rs.getString("profile_name"))
                .profileGuid(rs.getString("profile_guid"))
                .commodity(rs.getString("commodity"))
                .capacityLiters(getNullableDouble(rs, "capacity_liters"))
                .maxDepthM(getNullableDouble(rs, "max_depth_m"))
                .maxPressure(getNullableDouble(rs, "max_pressure"))
                .maxPressureBar(getNullableDouble(rs, "max_pressure_bar"))
                .maxDisplayPercent(getNullableDouble(rs, "max_display_percent"))
                .currentLevelLiters(getNullableDouble(rs, "current_level_liters"))
                .currentLevelPercent(rs.getDouble("current_level_percent"))
                .currentRawPercent(rs.getDouble("current_raw_percent"))
                .currentDepthM(getNullableDouble(rs, "current_depth_m"))
                .currentPressure(getNullableDouble(rs, "current_pressure"))
                .currentPressureBar(getNullableDouble(rs, "current_pressure_bar"))
                .ullageLiters(getNullableDouble(rs, "ullage_liters"))
                .dailyConsumptionLiters(getNullableDouble(rs, "daily_consumption_liters"))
                .daysRemaining(getNullableDouble(rs, "days_remaining"))
                .lastConsumptionCalcAt(getInstant(rs, "last_consumption_calc_at"))
                .consumptionCalcConfidence(rs.getString("consumption_calc_confidence"))
                .deviceGuid(rs.getString("device_guid"))
                .deviceSerial(rs.getString("device_serial"))
                .deviceModel(getNullableInteger(rs, "device_model"))
                .deviceModelName(rs.getString("device_model_name"))
                .deviceSku(rs.getString("device_sku"))
                .deviceNetworkId(rs.getString("device_network_id"))
                .helmetSerial(rs.getString("helmet_serial"))
                .online(rs.getBoolean("is_online"))
                .disabled(rs.getBoolean("is_disabled"))
                .deviceState(rs.getString("device_state"))
                .batteryVoltage(getNullableDouble(rs, "battery_voltage"))
                .temperatureC(getNullableDouble(rs, "temperature_c"))
                .deviceActivatedAt(getInstant(rs, "device_activated_at"))
                .deviceActivationEpoch(getNullableLong(rs, "device_activation_epoch"))
                .lastTelemetryAt(getInstant(rs, "last_telemetry_at"))
                .lastTelemetryEpoch(getNullableLong(rs, "last_telemetry_epoch"))
                .lastRawTelemetryAt(getInstant(rs, "last_raw_telemetry_at"))
                .lastRawTelemetryEpoch(getNullableLong(rs, "last_raw_telemetry_epoch"))
                .lastCalibratedTelemetryAt(getInstant(rs, "last_calibrated_telemetry_at"))
                .lastCalibratedTelemetryEpoch(getNullableLong(rs, "last_calibrated_telemetry_epoch"))
                .assetUpdatedAt(getInstant(rs, "asset_updated_at"))
                .assetUpdatedEpoch(getNullableLong(rs, "asset_updated_epoch"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
