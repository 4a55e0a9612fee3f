package com.fuelsight.ingestion.model;

import io.micronaut.http.HttpStatus;

/**
 * HTTP status plus body produced by the ingestion service for the controller to send.
 */
public record WebhookOutcome(HttpStatus status, Object body) {
}
