package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-facing result of a forecast run.
 */
public record ForecastOutcome(
    @JsonProperty("success")      boolean success,
    @JsonProperty("forecastId")   String forecastId,
    @JsonProperty("forecastData") ForecastRecord forecastData,
    @JsonProperty("error")        String error
) {
    public static ForecastOutcome completed(ForecastRecord record) {
        return new ForecastOutcome(true, record.forecastId(), record, null);
    }

    public static ForecastOutcome failed(ForecastRecord record) {
        return new ForecastOutcome(false, record.forecastId(), null, record.errorMessage());
    }
}
