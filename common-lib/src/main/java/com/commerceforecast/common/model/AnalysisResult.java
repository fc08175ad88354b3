package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform envelope returned by every analysis unit.
 *
 * <p>Exactly one of two shapes holds:
 * <ul>
 *   <li>{@code succeeded=true}: {@code payload} populated, {@code error} null</li>
 *   <li>{@code succeeded=false}: {@code payload} empty or partial, {@code error} set</li>
 * </ul>
 * {@code confidence} is clamped to [0, 100]; {@code durationMs} and cost are never negative.
 */
public record AnalysisResult(
    @JsonProperty("unitName")       UnitName unitName,
    @JsonProperty("succeeded")      boolean succeeded,
    @JsonProperty("payload")        Map<String, Object> payload,
    @JsonProperty("summary")        String summary,
    @JsonProperty("reasoningTrace") List<String> reasoningTrace,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("durationMs")     long durationMs,
    @JsonProperty("tokenUsage")     TokenUsage tokenUsage,
    @JsonProperty("costUsd")        double costUsd,
    @JsonProperty("error")          String error
) {
    public AnalysisResult {
        if (succeeded && error != null) {
            throw new IllegalArgumentException("Successful result for " + unitName + " must not carry an error");
        }
        if (!succeeded && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("Failed result for " + unitName + " must carry an error");
        }
        payload        = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        summary        = summary == null ? "" : summary;
        reasoningTrace = reasoningTrace == null ? List.of() : List.copyOf(reasoningTrace);
        confidence     = Math.max(0.0, Math.min(100.0, confidence));
        durationMs     = Math.max(0L, durationMs);
        tokenUsage     = tokenUsage == null ? TokenUsage.ZERO : tokenUsage;
        costUsd        = Math.max(0.0, costUsd);
    }

    public static AnalysisResult success(UnitName unitName, Map<String, Object> payload, String summary,
                                         List<String> reasoningTrace, double confidence,
                                         TokenUsage tokenUsage) {
        return new AnalysisResult(unitName, true, payload, summary, reasoningTrace,
                                  confidence, 0L, tokenUsage, 0.0, null);
    }

    public static AnalysisResult failure(UnitName unitName, String error, TokenUsage tokenUsage) {
        return new AnalysisResult(unitName, false, Map.of(),
                                  unitName.displayName() + " execution failed: " + error,
                                  List.of(), 0.0, 0L, tokenUsage, 0.0, error);
    }

    /** Returns a copy stamped with the measured wall-clock duration and computed cost. */
    public AnalysisResult withTiming(long durationMs, double costUsd) {
        return new AnalysisResult(unitName, succeeded, payload, summary, reasoningTrace,
                                  confidence, durationMs, tokenUsage, costUsd, error);
    }

    public int tokensUsed() {
        return tokenUsage.total();
    }
}
