package com.commerceforecast.common.exception;

/**
 * Caller supplied malformed or missing required input. Fatal, never retried,
 * and the only unit-level error that escapes the runner.
 */
public class InvalidRequestException extends ForecastException {

    public InvalidRequestException(String source, String message) {
        super(source, message);
    }
}
