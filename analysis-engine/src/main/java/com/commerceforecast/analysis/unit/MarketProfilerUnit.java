package com.commerceforecast.analysis.unit;

import com.commerceforecast.analysis.backend.GenerationBackend;
import com.commerceforecast.analysis.backend.GenerationRequest;
import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.UnitName;
import com.commerceforecast.common.payload.PayloadReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ranks the candidate cities as markets for the product and profiles demographics
 * and competition. {@code city_rankings} drives the advisory stage and scoring.
 */
@Component
public class MarketProfilerUnit implements AnalysisUnit {

    private static final Logger log = LoggerFactory.getLogger(MarketProfilerUnit.class);

    static final double TEMPERATURE        = 0.6;
    static final int    MAX_TOKENS         = 3500;
    static final double DEFAULT_CONFIDENCE = 70.0;
    static final int    MAX_PROMPT_CITIES  = 20;

    private static final String SYSTEM_PROMPT = """
        You are an expert Market Research and City Profiling analyst specialising in e-commerce
        expansion. You evaluate cities on demographics, purchasing power, e-commerce readiness,
        competition density and cultural fit, and rank them by overall market potential.
        Provide numerical scores (0-100), realistic estimates and clear reasoning.
        Respond in JSON format with structured data.
        """;

    private final GenerationBackend backend;
    private final StructuredResponseParser parser;

    public MarketProfilerUnit(GenerationBackend backend, StructuredResponseParser parser) {
        this.backend = backend;
        this.parser = parser;
    }

    @Override
    public UnitName name() { return UnitName.MARKET_PROFILER; }

    @Override
    public Mono<AnalysisResult> run(AnalysisRequest request) {
        RequestValidation.requirePresent(request, name(), "product_category");
        RequestValidation.requireNonEmptyList(request, name(), "cities", "No cities provided for analysis");

        String category = request.text("product_category", "");
        int cityCount = request.list("cities").size();
        log.info("[MarketProfiler] Analyzing cities={} category={}", cityCount, category);

        GenerationRequest generation = new GenerationRequest(
            SYSTEM_PROMPT, buildPrompt(request), true, TEMPERATURE, MAX_TOKENS);

        return backend.generate(generation)
            .map(response -> {
                Map<String, Object> data = parser.parse(response, name());
                return AnalysisResult.success(name(), data,
                    buildSummary(data, category),
                    reasoningTrace(data, cityCount),
                    PayloadReader.number(data, "confidence_score", DEFAULT_CONFIDENCE),
                    response.usage());
            });
    }

    private String buildPrompt(AnalysisRequest request) {
        String category = request.text("product_category", "");
        String price    = request.text("price_point", "0");
        return """
            Analyze these cities as potential markets for a %s product priced at $%s.

            Product Context:
            - Category: %s
            - Price Point: $%s
            - Target Demographics: %s

            Cities to Analyze:
            %s

            Provide comprehensive market analysis in JSON format:
            {
              "overall_market_assessment": {"market_size_estimate": "string", "growth_rate": "string",
                                            "market_maturity": "emerging|growing|mature|saturated"},
              "city_rankings": [
                {"city_name": "string", "country": "string", "overall_score": 0-100,
                 "demographic_match_score": 0-100, "purchasing_power_score": 0-100,
                 "ecommerce_readiness_score": 0-100, "competition_score": 0-100,
                 "cultural_fit_score": 0-100, "estimated_market_size": "string",
                 "key_advantages": ["..."], "key_challenges": ["..."]}
              ],
              "demographic_insights": {"ideal_customer_profile": "string", "age_groups": ["..."],
                                       "income_brackets": ["..."], "lifestyle_characteristics": ["..."]},
              "competitive_landscape": {"competition_intensity": "low|moderate|high|very high",
                                        "major_competitors": ["..."], "market_gaps": ["..."],
                                        "differentiation_strategies": ["..."]},
              "risk_assessment": [{"risk": "string", "severity": "high|medium|low", "mitigation": "string"}],
              "confidence_score": 0-100,
              "analysis_summary": "comprehensive summary"
            }

            Rank cities by overall market potential. Be realistic and data-driven.
            """.formatted(category, price, category, price,
                          request.list("target_demographics"), formatCities(request.list("cities")));
    }

    static String formatCities(List<Object> cities) {
        return cities.stream()
            .limit(MAX_PROMPT_CITIES)
            .filter(c -> c instanceof Map<?, ?>)
            .map(c -> {
                @SuppressWarnings("unchecked")
                Map<String, Object> city = (Map<String, Object>) c;
                return String.format(Locale.ROOT,
                    "- %s, %s: Pop %,d, GDP/capita $%,.0f, E-comm %s%%, Competition %s/100",
                    PayloadReader.text(city, "name", "Unknown"),
                    PayloadReader.text(city, "country", "Unknown"),
                    (long) PayloadReader.number(city, "population", 0),
                    PayloadReader.number(city, "gdp_per_capita", 0),
                    SummaryFormat.number(PayloadReader.number(city, "ecommerce_penetration", 0)),
                    SummaryFormat.number(PayloadReader.number(city, "competition_density", 0)));
            })
            .collect(Collectors.joining("\n"));
    }

    static List<String> reasoningTrace(Map<String, Object> data, int cityCount) {
        Map<String, Object> top = PayloadReader.first(data, "city_rankings");
        String topCity = top.isEmpty()
            ? "No cities ranked"
            : "Top city: " + PayloadReader.text(top, "city_name", "Unknown")
              + " (score: " + PayloadReader.text(top, "overall_score", "N/A") + "/100)";
        return List.of(
            "Analyzed " + cityCount + " cities for market potential",
            topCity,
            "Market maturity: " + PayloadReader.text(data, "overall_market_assessment.market_maturity", "unknown"),
            "Competition intensity: " + PayloadReader.text(data, "competitive_landscape.competition_intensity", "unknown"),
            "Identified " + PayloadReader.list(data, "competitive_landscape.market_gaps").size() + " market gaps"
        );
    }

    static String buildSummary(Map<String, Object> data, String category) {
        StringBuilder topCities = new StringBuilder();
        List<Map<String, Object>> rankings = PayloadReader.mapList(data, "city_rankings");
        for (int i = 0; i < Math.min(3, rankings.size()); i++) {
            Map<String, Object> city = rankings.get(i);
            List<Object> advantages = PayloadReader.list(city, "key_advantages");
            topCities.append(String.format("%n%d. %s, %s (Score: %s/100)",
                    i + 1,
                    PayloadReader.text(city, "city_name", "Unknown"),
                    PayloadReader.text(city, "country", "N/A"),
                    PayloadReader.text(city, "overall_score", "N/A")))
                .append("\n   - Market Size: ").append(PayloadReader.text(city, "estimated_market_size", "N/A"))
                .append("\n   - Key Advantage: ").append(advantages.isEmpty() ? "N/A" : advantages.get(0));
        }

        return """
            Market Analysis Summary for %s

            Market Overview:
            - Size: %s
            - Growth Rate: %s
            - Maturity: %s

            Top 3 Cities:%s

            Competition: %s
            Market Gaps: %d opportunities identified"""
            .formatted(
                category,
                PayloadReader.text(data, "overall_market_assessment.market_size_estimate", "N/A"),
                PayloadReader.text(data, "overall_market_assessment.growth_rate", "N/A"),
                SummaryFormat.capitalize(PayloadReader.text(data, "overall_market_assessment.market_maturity", "N/A")),
                topCities.length() == 0 ? "\nNo cities ranked" : topCities,
                SummaryFormat.capitalize(PayloadReader.text(data, "competitive_landscape.competition_intensity", "N/A")),
                PayloadReader.list(data, "competitive_landscape.market_gaps").size()
            ).strip();
    }
}
