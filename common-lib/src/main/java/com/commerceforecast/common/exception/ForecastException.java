package com.commerceforecast.common.exception;

/**
 * Root of the forecast error taxonomy. Messages are prefixed with the
 * component that raised them, e.g. {@code [Market Profiler] No cities provided}.
 */
public class ForecastException extends RuntimeException {
    private final String source;

    public ForecastException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public ForecastException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
