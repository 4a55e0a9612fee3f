package com.fuelsight.ingestion.service;

import com.fuelsight.ingestion.exception.PersistenceException;
import com.fuelsight.ingestion.model.SyncLog;
import com.fuelsight.ingestion.repository.SyncLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncLogServiceTest {

    @Mock
    private SyncLogRepository syncLogRepository;

    @Mock
    private NewRelicEventService newRelicEventService;

    private SyncLogService service;

    @BeforeEach
    void setUp() {
        service = new SyncLogService(syncLogRepository, newRelicEventService, 3, 20);
    }

    @Test
    @DisplayName("summary keeps the first three errors")
    void summarize() {
        assertThat(service.summarize(List.of("a", "b", "c", "d"))).isEqualTo("a; b; c");
        assertThat(service.summarize(List.of())).isNull();
        assertThat(service.summarize(List.of("x".repeat(50)))).hasSize(20);
    }

    @Test
    @DisplayName("long error messages are truncated before insert")
    void truncatesErrorMessage() {
        SyncLog syncLog = SyncLog.builder().syncType("gasbot_webhook").errorMessage("e".repeat(30)).build();

        service.record(syncLog);

        verify(syncLogRepository).insert(syncLog);
        assertThat(syncLog.getErrorMessage()).hasSize(20);
    }

    @Test
    @DisplayName("a failed insert is logged and the event is still emitted")
    void insertFailureDoesNotPropagate() {
        SyncLog syncLog = SyncLog.builder().syncType("manual_dip").syncStatus("success").build();
        when(syncLogRepository.insert(any())).thenThrow(new PersistenceException("db down", null));

        assertThatCode(() -> service.record(syncLog)).doesNotThrowAnyException();
        verify(newRelicEventService).emitSyncResult(syncLog);
    }
}
