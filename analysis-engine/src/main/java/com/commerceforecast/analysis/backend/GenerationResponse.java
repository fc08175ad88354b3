package com.commerceforecast.analysis.backend;

import com.commerceforecast.common.model.TokenUsage;

public record GenerationResponse(
    String content,
    int promptTokens,
    int completionTokens,
    String model
) {
    public TokenUsage usage() {
        return new TokenUsage(promptTokens, completionTokens);
    }
}
