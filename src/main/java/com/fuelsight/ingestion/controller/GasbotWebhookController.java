package com.fuelsight.ingestion.controller;

import com.fuelsight.ingestion.model.WebhookOutcome;
import com.fuelsight.ingestion.service.TelemetryIngestionService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.Post;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receiver for Gasbot dashboard webhook pushes.
 *
 * Base path: {@code /api/gasbot}
 *
 * The body is taken as raw text and parsed by {@link TelemetryIngestionService},
 * so a malformed body gets the same JSON failure response as any other rejected
 * request. Methods other than POST are answered 405 by the router.
 */
@Controller("/api/gasbot")
public class GasbotWebhookController {

    private static final Logger log = LoggerFactory.getLogger(GasbotWebhookController.class);

    @Inject
    private TelemetryIngestionService ingestionService;

    // -----------------------------------------------------------------------
    // POST /api/gasbot/webhook
    // -----------------------------------------------------------------------

    /**
     * Accepts a single tank record or an array of them.
     *
     * @param authorization {@code Bearer <secret>}
     * @param body          raw JSON body
     */
    @Post(value = "/webhook",
            consumes = {MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN},
            produces = MediaType.APPLICATION_JSON)
    public HttpResponse<Object> receive(@Nullable @Header(HttpHeaders.AUTHORIZATION) String authorization,
                                        @Nullable @Body String body) {
        log.info("POST /api/gasbot/webhook bytes={}", body == null ? 0 : body.length());
        WebhookOutcome outcome = ingestionService.handleWebhook(authorization, body);
        return HttpResponse.<Object>status(outcome.status()).body(outcome.body());
    }
}
