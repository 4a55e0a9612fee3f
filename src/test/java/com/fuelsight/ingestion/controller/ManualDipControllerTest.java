package com.fuelsight.ingestion.controller;

import com.fuelsight.ingestion.model.DipBatchRequest;
import com.fuelsight.ingestion.model.DipBatchResponse;
import com.fuelsight.ingestion.model.DipEntry;
import com.fuelsight.ingestion.model.DipEntryResult;
import com.fuelsight.ingestion.model.DipSummary;
import com.fuelsight.ingestion.service.ManualDipService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ManualDipControllerTest {

    @Mock
    private ManualDipService manualDipService;

    @InjectMocks
    private ManualDipController controller;

    @Test
    @DisplayName("partial failures still answer 200 with per-entry results")
    void returnsBatchResult() {
        DipBatchRequest request = new DipBatchRequest(List.of(
                new DipEntry("Main Diesel", 500d, null, "jo"),
                new DipEntry("Ghost", 10d, null, null)));
        DipBatchResponse result = new DipBatchResponse(true, new DipSummary(2, 1, 1, 0), List.of(
                DipEntryResult.failed("Ghost", "Tank not found: Ghost")));
        when(manualDipService.recordBatch(request)).thenReturn(result);

        HttpResponse<DipBatchResponse> response = controller.record(request);

        assertThat(response.getStatus().getCode()).isEqualTo(HttpStatus.OK.getCode());
        assertThat(response.body()).isEqualTo(result);
    }
}
