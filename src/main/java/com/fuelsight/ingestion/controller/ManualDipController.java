package com.fuelsight.ingestion.controller;

import com.fuelsight.ingestion.model.DipBatchRequest;
import com.fuelsight.ingestion.model.DipBatchResponse;
import com.fuelsight.ingestion.service.ManualDipService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dip entry.
 *
 * Base path: {@code /api/dips}
 */
@Controller("/api/dips")
public class ManualDipController {

    private static final Logger log = LoggerFactory.getLogger(ManualDipController.class);

    @Inject
    private ManualDipService manualDipService;

    /**
     * Records a batch of dips. Returns 200 with per-entry results even when some
     * entries fail; an empty {@code dips} array is rejected with 400.
     */
    @Post
    public HttpResponse<DipBatchResponse> record(@Body @Valid DipBatchRequest request) {
        log.info("POST /api/dips entries={}", request.dips().size());
        return HttpResponse.ok(manualDipService.recordBatch(request));
    }
}
