package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.repository.SyncLogRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes the audit row for one ingestion execution and forwards it to the event sink.
 *
 * {@link #record} never throws: a failed audit write is logged and must not change
 * the response already computed for the caller.
 */
@Singleton
public class SyncLogService {

    private static final Logger log = LoggerFactory.getLogger(SyncLogService.class);

    private final SyncLogRepository syncLogRepository;
    private final NewRelicEventService newRelicEventService;
    private final int maxErrors;
    private final int maxErrorLength;

    @Inject
    public SyncLogService(SyncLogRepository syncLogRepository,
                          NewRelicEventService newRelicEventService,
                          @Value("${ingestion.max-sync-log-errors:3}") int maxErrors,
                          @Value("${ingestion.sync-log-error-max-length:1000}") int maxErrorLength) {
        this.syncLogRepository = syncLogRepository;
        this.newRelicEventService = newRelicEventService;
        this.maxErrors = maxErrors;
        this.maxErrorLength = maxErrorLength;
    }

    public void record(SyncLog syncLog) {
        syncLog.setErrorMessage(truncate(syncLog.getErrorMessage()));
        try {
            syncLogRepository.insert(syncLog);
        } catch (Exception e) {
            log.error("Failed to write sync log type={} status={}: {}",
                    syncLog.getSyncType(), syncLog.getSyncStatus(), e.getMessage(), e);
        }
        newRelicEventService.emitSyncResult(syncLog);
    }

    /**
     * Joins the first few errors with {@code "; "}.
     *
     * @return the summary, or {@code null} when there are no errors
     */
    public String summarize(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        return truncate(String.join("; ", errors.subList(0, Math.min(maxErrors, errors.size()))));
    }

    private String truncate(String message) {
        if (message == null || message.length() <= maxErrorLength) {
            return message;
        }
        return message.substring(0, maxErrorLength);
    }
}
