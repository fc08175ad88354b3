package com.commerceforecast.common.scoring;

import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.PriceElasticity;
import com.commerceforecast.common.model.ScoreSet;
import com.commerceforecast.common.payload.PayloadReader;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ScoringEngine}: fixed-weight multi-factor model over the top-ranked city.
 *
 * <p><b>Formulas</b> (every result clamped to [0, 100] unless stated):
 * <pre>
 *   demand        = 0.40·productDemand + 0.30·marketSizeFactor + 0.20·ecommerceReadiness + 0.10·demographicMatch
 *   competition   = competitionScore × maturityMultiplier
 *   profitability = 0.45·purchasingPower + 0.35·productQuality + 0.20·(100 − competition)
 *   risk          = 0.50·competition + 0.30·maturityRisk + 0.20·entryRisk
 *   overall       = 0.40·demand + 0.30·profitability + 0.20·(100 − competition) + 0.10·marketFit
 *   monthlyVolume = ⌊baseVolume(marketSize) × demand/50 × (100 − competition)/50⌋, ≥ 0
 *   annualRevenue = monthlyVolume × averageUnitPrice × 12
 *   profitMargin  = clamp(40 + (100 − competition)·0.2, 15, 70)
 * </pre>
 *
 * <p>Missing inputs default to 50; unknown or missing labels take the {@code default}
 * entry of their table. An empty {@code city_rankings} list therefore scores on
 * defaults alone. Scores, money and prices are rounded half-up to two decimals.
 */
public class WeightedScoringEngine implements ScoringEngine {

    static final double DEMAND_WEIGHT        = 0.40;
    static final double PROFITABILITY_WEIGHT = 0.30;
    static final double COMPETITION_WEIGHT   = 0.20;
    static final double MARKET_FIT_WEIGHT    = 0.10;

    static final double DEFAULT_INPUT            = 50.0;
    static final double DEFAULT_UNIT_PRICE       = 50.0;
    static final double BASE_MARGIN              = 40.0;
    static final double MIN_MARGIN               = 15.0;
    static final double MAX_MARGIN               = 70.0;
    static final int    MAX_CITY_RANKINGS        = 10;

    static final Map<String, Double> MARKET_SIZE_FACTOR = Map.of(
        "small", 30.0, "medium", 60.0, "large", 85.0, "very large", 95.0);
    static final double DEFAULT_MARKET_SIZE_FACTOR = 60.0;

    static final Map<String, Double> MATURITY_MULTIPLIER = Map.of(
        "emerging", 0.7, "growing", 0.85, "mature", 1.0, "saturated", 1.2);
    static final double DEFAULT_MATURITY_MULTIPLIER = 1.0;

    static final Map<String, Double> MATURITY_RISK = Map.of(
        "emerging", 45.0, "growing", 25.0, "mature", 15.0, "saturated", 60.0);
    static final double DEFAULT_MATURITY_RISK = 30.0;

    static final Map<String, Double> ENTRY_RISK = Map.of(
        "easy", 10.0, "moderate", 30.0, "challenging", 60.0);
    static final double DEFAULT_ENTRY_RISK = 30.0;

    static final Map<String, Long> BASE_MONTHLY_VOLUME = Map.of(
        "small", 50L, "medium", 200L, "large", 800L, "very large", 2000L);
    static final long DEFAULT_BASE_MONTHLY_VOLUME = 200L;

    static final Map<String, Double> QUALITY_MULTIPLIER = Map.of(
        "premium", 1.3, "standard", 1.0, "budget", 0.7);
    static final double DEFAULT_QUALITY_MULTIPLIER = 1.0;

    @Override
    public ScoreSet score(Map<String, Object> productPayload,
                          Map<String, Object> marketPayload,
                          List<City> cities) {
        double productDemand  = PayloadReader.number(productPayload, "demand_analysis.demand_score", DEFAULT_INPUT);
        double productQuality = PayloadReader.number(productPayload, "quality_assessment.quality_score", DEFAULT_INPUT);
        double marketFit      = clamp(PayloadReader.number(productPayload, "market_fit.market_fit_score", DEFAULT_INPUT));
        String qualityTier    = PayloadReader.text(productPayload, "quality_assessment.quality_tier", null);
        Object priceRange     = PayloadReader.value(productPayload, "pricing_analysis.optimal_price_range");

        Map<String, Object> topCity = PayloadReader.first(marketPayload, "city_rankings");
        String marketSize        = PayloadReader.text(topCity, "estimated_market_size", null);
        double ecommerce         = PayloadReader.number(topCity, "ecommerce_readiness_score", DEFAULT_INPUT);
        double demographicMatch  = PayloadReader.number(topCity, "demographic_match_score", DEFAULT_INPUT);
        double competitionScore  = PayloadReader.number(topCity, "competition_score", DEFAULT_INPUT);
        double purchasingPower   = PayloadReader.number(topCity, "purchasing_power_score", DEFAULT_INPUT);
        String maturity          = PayloadReader.text(marketPayload, "overall_market_assessment.market_maturity", null);
        String entryDifficulty   = PayloadReader.text(marketPayload, "overall_market_assessment.entry_difficulty", null);

        double demand        = demandScore(productDemand, marketSize, ecommerce, demographicMatch);
        double competition   = competitionIndex(competitionScore, maturity);
        double profitability = profitabilityScore(purchasingPower, productQuality, competition);
        double risk          = riskScore(competition, maturity, entryDifficulty);
        double overall       = overallScore(demand, profitability, competition, marketFit);

        long   monthlyVolume = monthlySalesVolume(demand, marketSize, competition);
        double annualRevenue = monthlyVolume * averageUnitPrice(cities) * 12;
        double profitMargin  = profitMargin(competition);

        PriceBand band = PriceBand.parse(priceRange)
            .scaled(lookup(QUALITY_MULTIPLIER, qualityTier, DEFAULT_QUALITY_MULTIPLIER));

        List<Map<String, Object>> rankings = PayloadReader.mapList(marketPayload, "city_rankings");

        return new ScoreSet(
            round2(demand),
            round2(competition),
            round2(profitability),
            round2(marketFit),
            round2(risk),
            round2(overall),
            monthlyVolume,
            round2(annualRevenue),
            round2(profitMargin),
            round2(band.mid()),
            round2(band.min()),
            round2(band.max()),
            PriceElasticity.fromQualityTier(qualityTier),
            rankings.subList(0, Math.min(MAX_CITY_RANKINGS, rankings.size()))
        );
    }

    static double demandScore(double productDemand, String marketSize,
                              double ecommerceReadiness, double demographicMatch) {
        double sizeFactor = lookup(MARKET_SIZE_FACTOR, marketSize, DEFAULT_MARKET_SIZE_FACTOR);
        return clamp(productDemand * 0.4 + sizeFactor * 0.3
                     + ecommerceReadiness * 0.2 + demographicMatch * 0.1);
    }

    static double competitionIndex(double competitionScore, String maturity) {
        return clamp(competitionScore * lookup(MATURITY_MULTIPLIER, maturity, DEFAULT_MATURITY_MULTIPLIER));
    }

    static double profitabilityScore(double purchasingPower, double productQuality, double competitionIndex) {
        return clamp(purchasingPower * 0.45 + productQuality * 0.35 + (100 - competitionIndex) * 0.20);
    }

    static double riskScore(double competitionIndex, String maturity, String entryDifficulty) {
        return clamp(competitionIndex * 0.5
                     + lookup(MATURITY_RISK, maturity, DEFAULT_MATURITY_RISK) * 0.3
                     + lookup(ENTRY_RISK, entryDifficulty, DEFAULT_ENTRY_RISK) * 0.2);
    }

    static double overallScore(double demand, double profitability,
                               double competitionIndex, double marketFit) {
        return clamp(DEMAND_WEIGHT * demand
                     + PROFITABILITY_WEIGHT * profitability
                     + COMPETITION_WEIGHT * (100 - competitionIndex)
                     + MARKET_FIT_WEIGHT * marketFit);
    }

    static long monthlySalesVolume(double demand, String marketSize, double competitionIndex) {
        long base = lookup(BASE_MONTHLY_VOLUME, marketSize, DEFAULT_BASE_MONTHLY_VOLUME);
        double adjusted = base * (demand / 50.0) * ((100 - competitionIndex) / 50.0);
        return Math.max(0L, (long) adjusted);
    }

    static double profitMargin(double competitionIndex) {
        return Math.min(MAX_MARGIN, Math.max(MIN_MARGIN, BASE_MARGIN + (100 - competitionIndex) * 0.2));
    }

    /**
     * Mean positive {@code averageOrderValue} across the target cities, or the fixed fallback.
     */
    static double averageUnitPrice(List<City> cities) {
        if (cities == null) return DEFAULT_UNIT_PRICE;
        double[] values = cities.stream()
            .map(City::averageOrderValue)
            .filter(v -> v != null && Double.isFinite(v) && v > 0)
            .mapToDouble(Double::doubleValue)
            .toArray();
        if (values.length == 0) return DEFAULT_UNIT_PRICE;
        // Divide before summing so extreme order values cannot overflow.
        double mean = 0.0;
        for (double v : values) {
            mean += v / values.length;
        }
        return mean;
    }

    private static <T> T lookup(Map<String, T> table, String label, T fallback) {
        if (label == null) return fallback;
        return table.getOrDefault(label.trim().toLowerCase(), fallback);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.min(100.0, Math.max(0.0, value));
    }

    /** Half-up to two decimals; NaN becomes 0 and infinities saturate at the largest finite double. */
    static double round2(double value) {
        if (Double.isNaN(value)) return 0.0;
        if (Double.isInfinite(value)) value = Math.copySign(Double.MAX_VALUE, value);
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
