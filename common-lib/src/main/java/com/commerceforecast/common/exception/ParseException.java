package com.commerceforecast.common.exception;

import com.commerceforecast.common.model.TokenUsage;

/**
 * Backend content did not parse into the expected structured shape.
 * Carries the usage of the call, since the tokens were spent regardless.
 */
public class ParseException extends ForecastException {
    private final TokenUsage usage;

    public ParseException(String source, String message, TokenUsage usage) {
        super(source, message);
        this.usage = usage == null ? TokenUsage.ZERO : usage;
    }

    public ParseException(String source, String message, TokenUsage usage, Throwable cause) {
        super(source, message, cause);
        this.usage = usage == null ? TokenUsage.ZERO : usage;
    }

    public TokenUsage getUsage() {
        return usage;
    }
}
