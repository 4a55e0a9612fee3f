package com.fuelsight.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuelsight.ingestion.exception.IngestionException;
import com.fuelsight.ingestion.exception.RecordRejectedException;
import com.fuelsight.ingestion.model.AlertEvent;
import com.fuelsight.ingestion.model.ConsumptionEstimate;
import com.fuelsight.ingestion.model.FailureResponse;
import com.fuelsight.ingestion.model.GasbotTankPayload;
import com.fuelsight.ingestion.model.IngestionStats;
import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.model.SyncStatus;
import com.fuelsight.ingestion.model.TankAsset;
import com.fuelsight.ingestion.model.TankLocation;
import com.fuelsight.ingestion.model.TankReading;
import com.fuelsight.ingestion.model.WebhookOutcome;
import com.fuelsight.ingestion.model.WebhookResponse;
import com.fuelsight.ingestion.repository.AssetRepository;
import com.fuelsight.ingestion.repository.LocationRepository;
import com.fuelsight.ingestion.repository.ReadingRepository;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpStatus;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Top-level handler for Gasbot webhook deliveries.
 *
 * <p>Per request: authenticate, parse the body into one or more records, run every
 * record through the {@link PipelineStep} sequence, then respond and write exactly one
 * sync log. Records are processed one after another because each depends on the rows
 * written for it (location, then asset, then reading) and because the previous asset
 * state seen by the alert engine must reflect earlier records in the same batch.
 *
 * <p>A failure before any record is processed (configuration, authentication, body
 * shape) fails the request with a {@link FailureResponse}. A failure inside a record
 * only skips that record; the batch still answers 200 with {@code success = true}.
 */
@Singleton
public class TelemetryIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryIngestionService.class);

    static final String SYNC_TYPE = "gasbot_webhook";
    static final String BEARER_PREFIX = "Bearer ";

    private final LocationRepository locationRepository;
    private final AssetRepository assetRepository;
    private final ReadingRepository readingRepository;
    private final GasbotPayloadValidator validator;
    private final GasbotPayloadTransformer transformer;
    private final AlertEngine alertEngine;
    private final ConsumptionEstimator consumptionEstimator;
    private final SyncLogService syncLogService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String webhookSecret;
    private final Duration batchDeadline;
    private final int maxResponseErrors;

    @Inject
    public TelemetryIngestionService(LocationRepository locationRepository,
                                     AssetRepository assetRepository,
                                     ReadingRepository readingRepository,
                                     GasbotPayloadValidator validator,
                                     GasbotPayloadTransformer transformer,
                                     AlertEngine alertEngine,
                                     ConsumptionEstimator consumptionEstimator,
                                     SyncLogService syncLogService,
                                     ObjectMapper objectMapper,
                                     Clock clock,
                                     @Value("${gasbot.webhook.secret:}") String webhookSecret,
                                     @Value("${ingestion.batch-deadline:25s}") Duration batchDeadline,
                                     @Value("${ingestion.max-response-errors:5}") int maxResponseErrors) {
        this.locationRepository = locationRepository;
        this.assetRepository = assetRepository;
        this.readingRepository = readingRepository;
        this.validator = validator;
        this.transformer = transformer;
        this.alertEngine = alertEngine;
        this.consumptionEstimator = consumptionEstimator;
        this.syncLogService = syncLogService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webhookSecret = webhookSecret;
        this.batchDeadline = batchDeadline;
        this.maxResponseErrors = maxResponseErrors;
    }

    // -----------------------------------------------------------------------
    // Entry point
    // -----------------------------------------------------------------------

    /**
     * Handles one webhook delivery.
     *
     * @param authorization value of the {@code Authorization} header, may be {@code null}
     * @param body          raw request body, may be {@code null}
     * @return status and body for the HTTP response
     */
    public WebhookOutcome handleWebhook(String authorization, String body) {
        Instant startedAt = clock.instant();
        try {
            authenticate(authorization);
            List<JsonNode> records = parseRecords(body);
            log.info("Gasbot webhook received records={}", records.size());
            return processBatch(records, startedAt);

        } catch (IngestionException e) {
            long duration = elapsedMillis(startedAt);
            log.warn("Gasbot webhook rejected status={} error={} message={}",
                    e.getStatus().getCode(), e.getError(), e.getMessage());
            writeSyncLog(startedAt, new BatchTally(), duration, SyncStatus.ERROR, e.getMessage());
            return new WebhookOutcome(e.getStatus(), FailureResponse.of(e.getError(), e.getMessage(), duration));

        } catch (RuntimeException e) {
            long duration = elapsedMillis(startedAt);
            log.error("Gasbot webhook failed unexpectedly: {}", e.getMessage(), e);
            writeSyncLog(startedAt, new BatchTally(), duration, SyncStatus.ERROR, e.getMessage());
            return new WebhookOutcome(HttpStatus.INTERNAL_SERVER_ERROR,
                    FailureResponse.of("Internal server error", e.getMessage(), duration));
        }
    }

    // -----------------------------------------------------------------------
    // Request-level checks
    // -----------------------------------------------------------------------

    private void authenticate(String authorization) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            throw IngestionException.configuration("Webhook secret is not configured");
        }
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw IngestionException.unauthorized("Bearer token required in Authorization header");
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        byte[] expected = webhookSecret.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, expected)) {
            throw IngestionException.unauthorized("Invalid webhook secret");
        }
    }

    private List<JsonNode> parseRecords(String body) {
        if (body == null || body.isBlank()) {
            throw IngestionException.badRequest("Request body is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw IngestionException.badRequest("Malformed JSON body: " + e.getOriginalMessage());
        }

        List<JsonNode> records = new ArrayList<>();
        if (root != null && root.isArray()) {
            if (root.isEmpty()) {
                throw IngestionException.badRequest("Payload array is empty");
            }
            root.forEach(records::add);
        } else if (root != null && root.isObject()) {
            records.add(root);
        } else {
            String type = root == null ? "null" : root.getNodeType().name().toLowerCase();
            throw IngestionException.badRequest("Payload must be a JSON object or array, got " + type);
        }
        return records;
    }

    // -----------------------------------------------------------------------
    // Batch
    // -----------------------------------------------------------------------

    private WebhookOutcome processBatch(List<JsonNode> records, Instant startedAt) {
        Instant deadline = startedAt.plus(batchDeadline);
        BatchTally tally = new BatchTally();
        List<String> errors = new ArrayList<>();
        int processed = 0;

        for (int i = 0; i < records.size(); i++) {
            JsonNode node = records.get(i);
            String label = "Record " + (i + 1) + " (" + describe(node) + ")";

            if (clock.instant().isAfter(deadline)) {
                errors.add(label + ": batch deadline exceeded");
                continue;
            }

            Optional<String> failure = processRecord(node, label, tally);
            if (failure.isPresent()) {
                errors.add(failure.get());
            } else {
                processed++;
            }
        }

        long duration = elapsedMillis(startedAt);
        SyncStatus status = SyncStatus.of(processed, errors.size());
        writeSyncLog(startedAt, tally, duration, status, syncLogService.summarize(errors));

        log.info("Gasbot webhook completed status={} total={} processed={} errors={} alertsCreated={} durationMs={}",
                status.code(), records.size(), processed, errors.size(), tally.alertsCreated, duration);

        WebhookResponse response = new WebhookResponse(
                true,
                "Webhook processed successfully",
                new IngestionStats(records.size(), processed, errors.size(), duration),
                errors.isEmpty() ? null : List.copyOf(errors.subList(0, Math.min(maxResponseErrors, errors.size()))));
        return new WebhookOutcome(HttpStatus.OK, response);
    }

    // -----------------------------------------------------------------------
    // Record
    // -----------------------------------------------------------------------

    /**
     * Runs one record through the pipeline.
     *
     * @return the error message when a required step failed, empty on success
     */
    private Optional<String> processRecord(JsonNode node, String label, BatchTally tally) {
        StepResult<TransformedRecord> transformed = step(PipelineStep.TRANSFORM, label, () -> transform(node));
        if (transformed.abortsRecord()) {
            return Optional.of(label + ": " + transformed.failureMessage());
        }
        GasbotTankPayload payload = transformed.value().payload();
        TankAsset asset = transformed.value().asset();

        StepResult<TankLocation> location = step(PipelineStep.UPSERT_LOCATION, label,
                () -> locationRepository.upsert(transformed.value().location()));
        if (location.abortsRecord()) {
            return Optional.of(label + ": " + location.failureMessage());
        }
        tally.locations++;
        asset.setLocationId(location.value().getId());

        TankAsset previous = step(PipelineStep.FETCH_PREVIOUS_STATE, label,
                () -> assetRepository.findByExternalGuid(asset.getExternalGuid()).orElse(null)).valueOr(null);

        StepResult<TankAsset> saved = step(PipelineStep.UPSERT_ASSET, label, () -> assetRepository.upsert(asset));
        if (saved.abortsRecord()) {
            return Optional.of(label + ": " + saved.failureMessage());
        }
        tally.assets++;
        TankAsset current = saved.value();

        List<AlertEvent> alerts = step(PipelineStep.EVALUATE_ALERTS, label,
                () -> alertEngine.evaluate(current, payload, previous)).valueOr(List.of());
        if (!alerts.isEmpty()) {
            tally.alertsCreated += step(PipelineStep.PERSIST_ALERTS, label,
                    () -> alertEngine.persist(alerts)).valueOr(0);
        }

        ConsumptionEstimate estimate = step(PipelineStep.ESTIMATE_CONSUMPTION, label,
                () -> consumptionEstimator.estimate(current.getId(), current.getCurrentLevelPercent(),
                        current.getCapacityLiters())).valueOr(null);
        if (estimate != null && estimate.isEstimated()) {
            step(PipelineStep.OVERWRITE_CONSUMPTION, label, () -> {
                assetRepository.updateConsumption(current.getId(), estimate, clock.instant());
                return Boolean.TRUE;
            });
        }

        StepResult<TankReading> reading = step(PipelineStep.INSERT_READING, label,
                () -> readingRepository.insert(transformer.toReading(payload, current.getId())));
        if (reading.abortsRecord()) {
            return Optional.of(label + ": " + reading.failureMessage());
        }
        tally.readings++;
        return Optional.empty();
    }

    private TransformedRecord transform(JsonNode node) {
        GasbotPayloadValidator.ValidationResult validation = validator.validate(node);
        validation.warnings().forEach(w -> log.warn("Payload data-quality warning location={}: {}", describe(node), w));
        if (!validation.isValid()) {
            throw new RecordRejectedException(validation.errors());
        }

        GasbotTankPayload payload = GasbotTankPayload.fromJson(node);

        String rawData = node.toString();
        TankLocation location = transformer.toLocation(payload);
        location.setRawData(rawData);
        TankAsset asset = transformer.toAsset(payload, null);
        asset.setRawData(rawData);
        return new TransformedRecord(payload, location, asset);
    }

    private <T> StepResult<T> step(PipelineStep step, String label, Supplier<T> action) {
        StepResult<T> result = StepResult.run(step, action);
        if (!result.isSuccess()) {
            if (step.isRequired()) {
                log.error("{} step={} failed: {}", label, step, result.error().getMessage(), result.error());
            } else {
                log.warn("{} step={} failed, continuing: {}", label, step, result.error().getMessage());
            }
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void writeSyncLog(Instant startedAt, BatchTally tally, long duration, SyncStatus status, String error) {
        syncLogService.record(SyncLog.builder()
                .syncType(SYNC_TYPE)
                .syncStatus(status.code())
                .locationsProcessed(tally.locations)
                .assetsProcessed(tally.assets)
                .readingsProcessed(tally.readings)
                .alertsCreated(tally.alertsCreated)
                .errorMessage(error)
                .syncDurationMs(duration)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .build());
    }

    private long elapsedMillis(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }

    private static String describe(JsonNode node) {
        if (node != null && node.isObject()) {
            JsonNode id = node.hasNonNull("LocationId") ? node.get("LocationId") : node.get("LocationGuid");
            if (id != null && !id.isNull() && !id.asText().isBlank()) {
                return id.asText();
            }
        }
        return "unknown location";
    }

    private record TransformedRecord(GasbotTankPayload payload, TankLocation location, TankAsset asset) {
    }

    private static final class BatchTally {
        int locations;
        int assets;
        int readings;
        int alertsCreated;
    }
}
