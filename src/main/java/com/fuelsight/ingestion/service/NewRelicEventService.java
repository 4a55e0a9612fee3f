package com.fuelsight.ingestion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.model.TankAlert;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fire-and-forget sink that publishes raised alerts and sync outcomes as custom
 * events to the New Relic Events API.
 *
 * All public methods catch all exceptions internally and log warnings; they never throw.
 * Emission is skipped entirely when {@code newrelic.enabled} is false or no API key is set.
 */
@Singleton
public class NewRelicEventService {

    private static final Logger log = LoggerFactory.getLogger(NewRelicEventService.class);

    static final String ALERT_EVENT_TYPE = "TankAlertRaised";
    static final String SYNC_EVENT_TYPE = "TelemetrySyncResult";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String apiKey;
    private final String eventsUrl;

    @Inject
    public NewRelicEventService(@Client HttpClient httpClient,
                                ObjectMapper objectMapper,
                                @Value("${newrelic.enabled:false}") boolean enabled,
                                @Value("${newrelic.api-key:}") String apiKey,
                                @Value("${newrelic.events-url:}") String eventsUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.apiKey = apiKey;
        this.eventsUrl = eventsUrl;
    }

    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isBlank() && eventsUrl != null && !eventsUrl.isBlank();
    }

    /**
     * Emits a {@code TankAlertRaised} event for a newly inserted alert.
     */
    public void emitAlertRaised(TankAlert alert) {
        if (!isEnabled()) {
            return;
        }
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", ALERT_EVENT_TYPE);
            event.put("alertId", String.valueOf(alert.getId()));
            event.put("assetId", String.valueOf(alert.getAssetId()));
            event.put("alertType", alert.getAlertType());
            event.put("severity", alert.getSeverity());
            event.put("message", alert.getMessage());
            putIfPresent(event, "currentValue", alert.getCurrentValue());
            putIfPresent(event, "thresholdValue", alert.getThresholdValue());
            putIfPresent(event, "previousValue", alert.getPreviousValue());
            event.put("timestamp", toEpochMillis(alert.getCreatedAt()));

            postEvents(List.of(event), ALERT_EVENT_TYPE);
        } catch (Exception e) {
            log.warn("Failed to build {} event assetId={}: {}", ALERT_EVENT_TYPE, alert.getAssetId(), e.getMessage());
        }
    }

    /**
     * Emits a {@code TelemetrySyncResult} event summarising one ingestion execution.
     */
    public void emitSyncResult(SyncLog syncLog) {
        if (!isEnabled()) {
            return;
        }
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", SYNC_EVENT_TYPE);
            event.put("syncType", syncLog.getSyncType());
            event.put("syncStatus", syncLog.getSyncStatus());
            event.put("locationsProcessed", syncLog.getLocationsProcessed());
            event.put("assetsProcessed", syncLog.getAssetsProcessed());
            event.put("readingsProcessed", syncLog.getReadingsProcessed());
            event.put("alertsCreated", syncLog.getAlertsCreated());
            event.put("durationMs", syncLog.getSyncDurationMs());
            if (syncLog.getErrorMessage() != null) {
                event.put("errorMessage", syncLog.getErrorMessage());
            }
            event.put("timestamp", toEpochMillis(syncLog.getCompletedAt()));

            postEvents(List.of(event), SYNC_EVENT_TYPE);
        } catch (Exception e) {
            log.warn("Failed to build {} event syncType={}: {}", SYNC_EVENT_TYPE, syncLog.getSyncType(), e.getMessage());
        }
    }

    private void postEvents(List<Map<String, Object>> events, String eventType) {
        try {
            String payload = objectMapper.writeValueAsString(events);

            HttpRequest<String> request = HttpRequest.POST(eventsUrl, payload)
                    .contentType(MediaType.APPLICATION_JSON_TYPE)
                    .header("X-Insert-Key", apiKey);

            HttpResponse<String> response = httpClient.toBlocking().exchange(request, String.class);
            log.info("NR {} POST status={} events={}", eventType, response.getStatus().getCode(), events.size());

        } catch (Exception e) {
            log.warn("NR POST failed for eventType={} events={}: {}", eventType, events.size(), e.getMessage());
        }
    }

    private static void putIfPresent(Map<String, Object> event, String key, Object value) {
        if (value != null) {
            event.put(key, value);
        }
    }

    private static long toEpochMillis(Instant instant) {
        return instant == null ? System.currentTimeMillis() : instant.toEpochMilli();
    }
}
