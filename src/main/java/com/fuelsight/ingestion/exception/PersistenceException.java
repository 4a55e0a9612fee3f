package com.fuelsight.ingestion.exception;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} and JSON serialization
 * failures raised by the JDBC repositories.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
