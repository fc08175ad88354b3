package com.commerceforecast.common.exception;

/**
 * Persistence collaborator failed. Fatal infrastructure error outside the scoring domain.
 */
public class ForecastPersistenceException extends ForecastException {

    public ForecastPersistenceException(String message, Throwable cause) {
        super("ForecastStore", message, cause);
    }

    public ForecastPersistenceException(String message) {
        super("ForecastStore", message);
    }
}
