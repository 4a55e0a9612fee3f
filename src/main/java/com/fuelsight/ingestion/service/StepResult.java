package com.fuelsight.ingestion.service;

import java.util.function.Supplier;

/**
 * Value or captured failure of one {@link PipelineStep}.
 */
public record StepResult<T>(PipelineStep step, T value, RuntimeException error) {

    public static <T> StepResult<T> run(PipelineStep step, Supplier<T> action) {
        try {
            return new StepResult<>(step, action.get(), null);
        } catch (RuntimeException e) {
            return new StepResult<>(step, null, e);
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** {@code true} when the step failed and its failure ends the record. */
    public boolean abortsRecord() {
        return !isSuccess() && step.isRequired();
    }

    public T valueOr(T fallback) {
        return isSuccess() && value != null ? value : fallback;
    }

    public String failureMessage() {
        return step.failurePrefix() + ": " + error.getMessage();
    }
}
