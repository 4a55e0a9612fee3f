package com.fuelsight.ingestion.exception;

import io.micronaut.http.HttpStatus;

/**
 * Failure of a whole ingestion request, raised before any record is processed
 * (missing configuration, failed authentication or a malformed body).
 *
 * The orchestrator turns it into a {@link com.fuelsight.ingestion.model.FailureResponse}
 * with {@link #getStatus()} and writes an {@code error} sync log.
 */
public class IngestionException extends RuntimeException {

    private final HttpStatus status;
    private final String error;

    public IngestionException(HttpStatus status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    public static IngestionException configuration(String message) {
        return new IngestionException(HttpStatus.INTERNAL_SERVER_ERROR, "Server configuration error", message);
    }

    public static IngestionException unauthorized(String message) {
        return new IngestionException(HttpStatus.UNAUTHORIZED, "Unauthorized", message);
    }

    public static IngestionException badRequest(String message) {
        return new IngestionException(HttpStatus.BAD_REQUEST, "Invalid payload", message);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }
}
