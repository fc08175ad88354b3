package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Summary and payload copied from one successful unit into the forecast.
 */
public record UnitSection(
    @JsonProperty("summary") String summary,
    @JsonProperty("payload") Map<String, Object> payload
) {
    /** Section for a succeeded result, or null when the unit failed or never ran. */
    public static UnitSection from(AnalysisResult result) {
        if (result == null || !result.succeeded()) return null;
        return new UnitSection(result.summary(), result.payload());
    }
}
