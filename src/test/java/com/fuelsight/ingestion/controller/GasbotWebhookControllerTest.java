package com.fuelsight.ingestion.controller;

import com.fuelsight.ingestion.model.FailureResponse;
import com.fuelsight.ingestion.model.IngestionStats;
import com.fuelsight.ingestion.model.WebhookOutcome;
import com.fuelsight.ingestion.model.WebhookResponse;
import com.fuelsight.ingestion.service.TelemetryIngestionService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GasbotWebhookControllerTest {

    @Mock
    private TelemetryIngestionService ingestionService;

    @InjectMocks
    private GasbotWebhookController controller;

    @Test
    @DisplayName("service outcome is passed through as status and body")
    void passesOutcomeThrough() {
        WebhookResponse body = new WebhookResponse(true, "Webhook processed successfully",
                new IngestionStats(1, 1, 0, 12), null);
        when(ingestionService.handleWebhook("Bearer s", "{}")).thenReturn(new WebhookOutcome(HttpStatus.OK, body));

        HttpResponse<Object> response = controller.receive("Bearer s", "{}");

        assertThat(response.getStatus().getCode()).isEqualTo(HttpStatus.OK.getCode());
        assertThat(response.body()).isEqualTo(body);
    }

    @Test
    @DisplayName("rejections keep their status code")
    void passesRejectionThrough() {
        FailureResponse failure = FailureResponse.of("Unauthorized", "Invalid webhook secret", 1);
        when(ingestionService.handleWebhook(null, null))
                .thenReturn(new WebhookOutcome(HttpStatus.UNAUTHORIZED, failure));

        HttpResponse<Object> response = controller.receive(null, null);

        assertThat(response.getStatus().getCode()).isEqualTo(HttpStatus.UNAUTHORIZED.getCode());
        assertThat(response.body()).isEqualTo(failure);
    }
}
