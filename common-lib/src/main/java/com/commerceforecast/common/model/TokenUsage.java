package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token counts reported by the generation backend for one call.
 */
public record TokenUsage(
    @JsonProperty("promptTokens")     int promptTokens,
    @JsonProperty("completionTokens") int completionTokens
) {
    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    public TokenUsage {
        promptTokens     = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
    }

    public int total() {
        return promptTokens + completionTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) return this;
        return new TokenUsage(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }
}
