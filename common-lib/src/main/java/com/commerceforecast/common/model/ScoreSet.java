package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Numeric output of the scoring engine.
 *
 * <p>Ranges: every {@code *Score} and {@code competitionIndex} in [0, 100];
 * {@code expectedProfitMargin} in [15, 70]; volume and revenue non-negative;
 * {@code recommendedPriceMin ≤ recommendedPrice ≤ recommendedPriceMax}, all positive;
 * {@code cityRankings} holds at most ten entries in market-unit rank order.
 */
public record ScoreSet(
    @JsonProperty("demandScore")                double demandScore,
    @JsonProperty("competitionIndex")           double competitionIndex,
    @JsonProperty("profitabilityScore")         double profitabilityScore,
    @JsonProperty("marketFitScore")             double marketFitScore,
    @JsonProperty("riskScore")                  double riskScore,
    @JsonProperty("overallScore")               double overallScore,
    @JsonProperty("expectedMonthlySalesVolume") long expectedMonthlySalesVolume,
    @JsonProperty("expectedAnnualRevenue")      double expectedAnnualRevenue,
    @JsonProperty("expectedProfitMargin")       double expectedProfitMargin,
    @JsonProperty("recommendedPrice")           double recommendedPrice,
    @JsonProperty("recommendedPriceMin")        double recommendedPriceMin,
    @JsonProperty("recommendedPriceMax")        double recommendedPriceMax,
    @JsonProperty("priceElasticity")            PriceElasticity priceElasticity,
    @JsonProperty("cityRankings")               List<Map<String, Object>> cityRankings
) {
    public ScoreSet {
        cityRankings = cityRankings == null ? List.of() : List.copyOf(cityRankings);
    }
}
