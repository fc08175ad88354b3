package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One audit-log entry per unit invocation. {@code output} is already truncated.
 */
public record UnitExecutionAudit(
    @JsonProperty("forecastId")       String forecastId,
    @JsonProperty("unit")             UnitName unit,
    @JsonProperty("status")           String status,
    @JsonProperty("succeeded")        boolean succeeded,
    @JsonProperty("startedAt")        Instant startedAt,
    @JsonProperty("completedAt")      Instant completedAt,
    @JsonProperty("durationMs")       long durationMs,
    @JsonProperty("promptTokens")     int promptTokens,
    @JsonProperty("completionTokens") int completionTokens,
    @JsonProperty("tokensUsed")       int tokensUsed,
    @JsonProperty("costUsd")          double costUsd,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("reasoningTrace")   List<String> reasoningTrace,
    @JsonProperty("summary")          String summary,
    @JsonProperty("output")           String output,
    @JsonProperty("error")            String error,
    @JsonProperty("retryCount")       int retryCount,
    @JsonProperty("modelName")        String modelName
) {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED    = "failed";
}
