package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate built by one coordinator run.
 *
 * <p>Immutable: each lifecycle transition returns a new record. Legal transitions are
 * {@code PENDING → PROCESSING → COMPLETED | FAILED} and {@code PENDING → FAILED};
 * anything else throws {@link IllegalStateException}.
 *
 * <p>Unit sections are null when the unit failed or never ran. {@code tokensUsed}
 * and {@code costUsd} sum over succeeded units only.
 */
public record ForecastRecord(
    @JsonProperty("forecastId")                String forecastId,
    @JsonProperty("productId")                 String productId,
    @JsonProperty("status")                    ForecastStatus status,
    @JsonProperty("productAnalysis")           UnitSection productAnalysis,
    @JsonProperty("marketAnalysis")            UnitSection marketAnalysis,
    @JsonProperty("advertisingStrategy")       UnitSection advertisingStrategy,
    @JsonProperty("supplyChain")               UnitSection supplyChain,
    @JsonProperty("salesStrategy")             UnitSection salesStrategy,
    @JsonProperty("scores")                    ScoreSet scores,
    @JsonProperty("tokensUsed")                int tokensUsed,
    @JsonProperty("costUsd")                   double costUsd,
    @JsonProperty("processingStartedAt")       Instant processingStartedAt,
    @JsonProperty("processingCompletedAt")     Instant processingCompletedAt,
    @JsonProperty("processingDurationSeconds") Double processingDurationSeconds,
    @JsonProperty("errorMessage")              String errorMessage,
    @JsonProperty("modelVersion")              String modelVersion
) {
    public static ForecastRecord pending(String forecastId, String productId) {
        return new ForecastRecord(forecastId, productId, ForecastStatus.PENDING,
                                  null, null, null, null, null, null,
                                  0, 0.0, null, null, null, null, null);
    }

    public ForecastRecord processing(Instant startedAt, String modelVersion) {
        requireStatus(ForecastStatus.PENDING, ForecastStatus.PROCESSING);
        return new ForecastRecord(forecastId, productId, ForecastStatus.PROCESSING,
                                  null, null, null, null, null, null,
                                  0, 0.0, startedAt, null, null, null, modelVersion);
    }

    /**
     * Copies summaries and payloads of the given results into their unit slots and
     * sums usage across the succeeded ones. Status is left unchanged.
     */
    public ForecastRecord aggregate(Collection<AnalysisResult> results) {
        Map<UnitName, UnitSection> sections = new EnumMap<>(UnitName.class);
        int tokens = 0;
        double cost = 0.0;
        for (AnalysisResult r : results) {
            if (r == null) continue;
            UnitSection section = UnitSection.from(r);
            if (section != null) {
                sections.put(r.unitName(), section);
                tokens += r.tokensUsed();
                cost   += r.costUsd();
            }
        }
        return new ForecastRecord(forecastId, productId, status,
                                  sections.get(UnitName.PRODUCT_ANALYST),
                                  sections.get(UnitName.MARKET_PROFILER),
                                  sections.get(UnitName.ADVERTISING_PLANNER),
                                  sections.get(UnitName.SUPPLY_CHAIN_ADVISOR),
                                  sections.get(UnitName.SALES_STRATEGY),
                                  scores, tokens, cost,
                                  processingStartedAt, processingCompletedAt,
                                  processingDurationSeconds, errorMessage, modelVersion);
    }

    public ForecastRecord completed(ScoreSet scores, Instant completedAt) {
        requireStatus(ForecastStatus.PROCESSING, ForecastStatus.COMPLETED);
        return new ForecastRecord(forecastId, productId, ForecastStatus.COMPLETED,
                                  productAnalysis, marketAnalysis, advertisingStrategy,
                                  supplyChain, salesStrategy, scores, tokensUsed, costUsd,
                                  processingStartedAt, completedAt,
                                  elapsedSeconds(completedAt), null, modelVersion);
    }

    public ForecastRecord failed(String errorMessage, Instant completedAt) {
        if (status != ForecastStatus.PENDING && status != ForecastStatus.PROCESSING) {
            throw new IllegalStateException("Cannot fail forecast " + forecastId + " in status " + status);
        }
        return new ForecastRecord(forecastId, productId, ForecastStatus.FAILED,
                                  productAnalysis, marketAnalysis, advertisingStrategy,
                                  supplyChain, salesStrategy, null, tokensUsed, costUsd,
                                  processingStartedAt, completedAt,
                                  elapsedSeconds(completedAt), errorMessage, modelVersion);
    }

    public UnitSection section(UnitName unit) {
        return switch (unit) {
            case PRODUCT_ANALYST      -> productAnalysis;
            case MARKET_PROFILER      -> marketAnalysis;
            case ADVERTISING_PLANNER  -> advertisingStrategy;
            case SUPPLY_CHAIN_ADVISOR -> supplyChain;
            case SALES_STRATEGY       -> salesStrategy;
        };
    }

    private Double elapsedSeconds(Instant completedAt) {
        if (processingStartedAt == null || completedAt == null) return null;
        return Duration.between(processingStartedAt, completedAt).toMillis() / 1000.0;
    }

    private void requireStatus(ForecastStatus expected, ForecastStatus target) {
        if (status != expected) {
            throw new IllegalStateException("Cannot move forecast " + forecastId
                + " from " + status + " to " + target);
        }
    }
}
