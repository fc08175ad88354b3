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
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plans paid advertising across Meta, Google and TikTok for the top-ranked city.
 */
@Component
public class AdvertisingPlannerUnit implements AnalysisUnit {

    private static final Logger log = LoggerFactory.getLogger(AdvertisingPlannerUnit.class);

    static final double TEMPERATURE        = 0.8;
    static final int    MAX_TOKENS         = 4000;
    static final double DEFAULT_CONFIDENCE = 80.0;

    private static final String SYSTEM_PROMPT = """
        You are an expert digital advertising strategist for e-commerce brands, experienced with
        Meta (Facebook/Instagram), Google Ads and TikTok Ads. You design platform mixes, targeting,
        ad copy, budget allocation and KPI targets based on industry benchmarks.
        Respond in JSON format with structured data.
        """;

    private final GenerationBackend backend;
    private final StructuredResponseParser parser;

    public AdvertisingPlannerUnit(GenerationBackend backend, StructuredResponseParser parser) {
        this.backend = backend;
        this.parser = parser;
    }

    @Override
    public UnitName name() { return UnitName.ADVERTISING_PLANNER; }

    @Override
    public Mono<AnalysisResult> run(AnalysisRequest request) {
        RequestValidation.requirePresent(request, name(), "product_name", "product_category", "price");

        String productName = request.text("product_name", "Unknown");
        log.info("[AdvertisingPlanner] Creating advertising plan product={} city={}",
            productName, request.text("target_city", "N/A"));

        GenerationRequest generation = new GenerationRequest(
            SYSTEM_PROMPT, buildPrompt(request), true, TEMPERATURE, MAX_TOKENS);

        return backend.generate(generation)
            .map(response -> {
                Map<String, Object> data = parser.parse(response, name());
                return AnalysisResult.success(name(), data,
                    buildSummary(data, productName),
                    reasoningTrace(data),
                    PayloadReader.number(data, "confidence_score", DEFAULT_CONFIDENCE),
                    response.usage());
            });
    }

    private String buildPrompt(AnalysisRequest request) {
        Map<String, Object> budget = request.map("budget_range");
        return """
            Create a comprehensive advertising strategy for this product:

            Product Details:
            - Name: %s
            - Category: %s
            - Price: $%s
            - Target Market: %s
            - Target Demographics: %s
            - Monthly Budget Range: $%s - $%s
            - Campaign Objective: %s

            Create detailed advertising strategies in JSON format:
            {
              "platform_recommendations": [{"platform": "Meta|Google|TikTok", "priority": "high|medium|low",
                                            "rationale": "string", "budget_allocation_percentage": 0-100}],
              "meta_ads_strategy": {"platforms": ["Facebook", "Instagram"], "targeting": {},
                                    "ad_copy_variations": [{"headline": "string", "primary_text": "string", "cta": "string"}]},
              "google_ads_strategy": {"campaign_types": ["..."], "targeting": {"keywords": ["..."]},
                                      "ad_copy_variations": [{"headline_1": "string", "description_1": "string"}]},
              "tiktok_ads_strategy": {"campaign_type": "string", "content_strategy": {"hooks": ["..."]}},
              "budget_allocation": {"total_monthly_budget": 0.0, "meta_budget": 0.0, "google_budget": 0.0,
                                    "tiktok_budget": 0.0, "testing_budget": 0.0, "allocation_rationale": "string"},
              "kpi_targets": {"target_cpa": 0.0, "target_roas": 0.0, "target_monthly_sales": 0, "target_revenue": 0.0},
              "recommendations": ["..."],
              "confidence_score": 0-100
            }

            Be creative with ad copy while maintaining professionalism.
            Provide realistic estimates based on industry benchmarks.
            """.formatted(
                request.text("product_name", "Unknown"),
                request.text("product_category", ""),
                request.text("price", "0"),
                request.text("target_city", "N/A"),
                request.map("target_demographics"),
                PayloadReader.text(budget, "min", "1000"),
                PayloadReader.text(budget, "max", "5000"),
                request.text("campaign_objective", "conversion")
            );
    }

    static List<String> reasoningTrace(Map<String, Object> data) {
        String platforms = PayloadReader.mapList(data, "platform_recommendations").stream()
            .map(p -> PayloadReader.text(p, "platform", "unknown"))
            .collect(Collectors.joining(", "));
        return List.of(
            "Recommended platforms: " + (platforms.isEmpty() ? "none" : platforms),
            "Generated " + PayloadReader.list(data, "meta_ads_strategy.ad_copy_variations").size() + " Meta ad variations",
            "Created " + PayloadReader.list(data, "google_ads_strategy.ad_copy_variations").size() + " Google ad variations",
            "Budget allocation: " + PayloadReader.text(data, "budget_allocation.allocation_rationale", "not specified"),
            "Expected ROAS: " + PayloadReader.text(data, "kpi_targets.target_roas", "N/A")
        );
    }

    static String buildSummary(Map<String, Object> data, String productName) {
        String priorities = PayloadReader.mapList(data, "platform_recommendations").stream()
            .limit(3)
            .map(p -> "- " + PayloadReader.text(p, "platform", "unknown") + ": "
                + PayloadReader.text(p, "priority", "n/a").toUpperCase() + " priority - "
                + PayloadReader.text(p, "rationale", ""))
            .collect(Collectors.joining("\n"));

        return """
            Advertising Strategy for %s

            Budget Allocation:
            - Total Monthly: %s
            - Meta Ads: %s
            - Google Ads: %s
            - TikTok Ads: %s

            Expected Performance:
            - Target ROAS: %sx
            - Target CPA: %s
            - Monthly Sales Target: %s units
            - Expected Revenue: %s

            Platform Priorities:
            %s

            Key Recommendations:
            %s"""
            .formatted(
                productName,
                SummaryFormat.money(PayloadReader.number(data, "budget_allocation.total_monthly_budget", 0)),
                SummaryFormat.money(PayloadReader.number(data, "budget_allocation.meta_budget", 0)),
                SummaryFormat.money(PayloadReader.number(data, "budget_allocation.google_budget", 0)),
                SummaryFormat.money(PayloadReader.number(data, "budget_allocation.tiktok_budget", 0)),
                SummaryFormat.number(PayloadReader.number(data, "kpi_targets.target_roas", 0)),
                SummaryFormat.money(PayloadReader.number(data, "kpi_targets.target_cpa", 0)),
                SummaryFormat.number(PayloadReader.number(data, "kpi_targets.target_monthly_sales", 0)),
                SummaryFormat.money(PayloadReader.number(data, "kpi_targets.target_revenue", 0)),
                priorities.isEmpty() ? "- none provided" : priorities,
                SummaryFormat.bullets(PayloadReader.list(data, "recommendations"), 3)
            ).strip();
    }
}
