package com.commerceforecast.common.exception;

/**
 * Generation backend unreachable, erroring or timed out.
 */
public class BackendException extends ForecastException {

    public BackendException(String source, String message) {
        super(source, message);
    }

    public BackendException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
