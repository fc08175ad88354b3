package com.commerceforecast.common.model;

/**
 * Forecast lifecycle: {@code PENDING → PROCESSING → COMPLETED | FAILED}.
 * {@code CANCELLED} is only ever set outside the pipeline.
 */
public enum ForecastStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
