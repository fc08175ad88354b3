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

/**
 * Picks marketplaces, designs the sales funnel, email sequences and upsells.
 */
@Component
public class SalesStrategyUnit implements AnalysisUnit {

    private static final Logger log = LoggerFactory.getLogger(SalesStrategyUnit.class);

    static final double TEMPERATURE        = 0.7;
    static final int    MAX_TOKENS         = 4000;
    static final double DEFAULT_CONFIDENCE = 80.0;

    private static final String SYSTEM_PROMPT = """
        You are an expert e-commerce Sales Strategist. You choose marketplaces (Amazon, Etsy, Shopify,
        regional platforms), design conversion funnels, email marketing sequences, upsell and
        cross-sell offers, and set conversion benchmarks and KPIs.
        Respond in JSON format with structured data.
        """;

    private final GenerationBackend backend;
    private final StructuredResponseParser parser;

    public SalesStrategyUnit(GenerationBackend backend, StructuredResponseParser parser) {
        this.backend = backend;
        this.parser = parser;
    }

    @Override
    public UnitName name() { return UnitName.SALES_STRATEGY; }

    @Override
    public Mono<AnalysisResult> run(AnalysisRequest request) {
        RequestValidation.requirePresent(request, name(), "product_name", "price");

        String productName = request.text("product_name", "Unknown");
        log.info("[SalesStrategy] Creating sales strategy product={}", productName);

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
        return """
            Create a comprehensive sales strategy for this product:

            Product Details:
            - Name: %s
            - Category: %s
            - Price: $%s
            - Target Audience: %s
            - Unique Selling Points: %s
            - Competition Level: %s

            Provide the sales strategy in JSON format:
            {
              "marketplace_recommendations": [{"platform": "string", "priority": "primary|secondary|tertiary",
                                               "rationale": "string", "fee_structure": "string"}],
              "sales_funnel": {"funnel_type": "string", "stages": [{"stage": "string", "tactics": ["..."]}]},
              "email_marketing_sequences": {"welcome_series": [{"subject": "string"}],
                                            "abandoned_cart_series": [{"subject": "string"}],
                                            "post_purchase_series": [{"subject": "string"}]},
              "upsell_downsell_strategy": {"upsells": ["..."], "cross_sells": ["..."]},
              "metrics_and_kpis": {"conversion_funnel_benchmarks": {"overall_conversion": "string",
                                   "average_order_value": 0.0, "customer_lifetime_value": 0.0}},
              "recommendations": ["..."],
              "confidence_score": 0-100
            }
            """.formatted(
                request.text("product_name", "Unknown"),
                request.text("product_category", ""),
                request.text("price", "0"),
                request.map("target_audience"),
                request.list("unique_selling_points"),
                request.text("competition_level", "moderate")
            );
    }

    static Map<String, Object> primaryMarketplace(Map<String, Object> data) {
        return PayloadReader.mapList(data, "marketplace_recommendations").stream()
            .filter(m -> "primary".equalsIgnoreCase(PayloadReader.text(m, "priority", "")))
            .findFirst()
            .orElse(Map.of());
    }

    static List<String> reasoningTrace(Map<String, Object> data) {
        return List.of(
            "Primary marketplace: " + PayloadReader.text(primaryMarketplace(data), "platform", "N/A"),
            "Funnel type: " + PayloadReader.text(data, "sales_funnel.funnel_type", "N/A"),
            "Created " + PayloadReader.list(data, "email_marketing_sequences.welcome_series").size() + " welcome emails",
            "Identified " + PayloadReader.list(data, "upsell_downsell_strategy.upsells").size() + " upsell opportunities",
            "Target conversion rate: "
                + PayloadReader.text(data, "metrics_and_kpis.conversion_funnel_benchmarks.overall_conversion", "N/A")
        );
    }

    static String buildSummary(Map<String, Object> data, String productName) {
        String benchmarks = "metrics_and_kpis.conversion_funnel_benchmarks.";
        String emails = "email_marketing_sequences.";
        return """
            Sales Strategy for %s

            Primary Marketplace: %s
            Funnel Type: %s

            Expected Performance:
            - Overall Conversion Rate: %s
            - Average Order Value: %s
            - Customer Lifetime Value: %s

            Email Sequences:
            - Welcome Series: %d emails
            - Abandoned Cart: %d emails
            - Post-Purchase: %d emails

            Upsell Strategy:
            - %d upsell offers identified
            - %d cross-sell opportunities

            Top Recommendations:
            %s"""
            .formatted(
                productName,
                PayloadReader.text(primaryMarketplace(data), "platform", "N/A"),
                PayloadReader.text(data, "sales_funnel.funnel_type", "N/A").replace('_', ' '),
                PayloadReader.text(data, benchmarks + "overall_conversion", "N/A"),
                SummaryFormat.money(PayloadReader.number(data, benchmarks + "average_order_value", 0)),
                SummaryFormat.money(PayloadReader.number(data, benchmarks + "customer_lifetime_value", 0)),
                PayloadReader.list(data, emails + "welcome_series").size(),
                PayloadReader.list(data, emails + "abandoned_cart_series").size(),
                PayloadReader.list(data, emails + "post_purchase_series").size(),
                PayloadReader.list(data, "upsell_downsell_strategy.upsells").size(),
                PayloadReader.list(data, "upsell_downsell_strategy.cross_sells").size(),
                SummaryFormat.bullets(PayloadReader.list(data, "recommendations"), 3)
            ).strip();
    }
}
