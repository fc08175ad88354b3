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
 * Recommends a manufacturing method, suppliers, unit cost breakdown and lead times.
 */
@Component
public class SupplyChainAdvisorUnit implements AnalysisUnit {

    private static final Logger log = LoggerFactory.getLogger(SupplyChainAdvisorUnit.class);

    static final double TEMPERATURE        = 0.6;
    static final int    MAX_TOKENS         = 3500;
    static final double DEFAULT_CONFIDENCE = 75.0;

    private static final String SYSTEM_PROMPT = """
        You are an expert Supply Chain and Manufacturing advisor for e-commerce products, covering
        in-house production, FASON contract manufacturing, dropshipping and hybrid models. You
        recommend supplier regions, cost structures, lead times, logistics and quality control.
        Respond in JSON format with structured data.
        """;

    private final GenerationBackend backend;
    private final StructuredResponseParser parser;

    public SupplyChainAdvisorUnit(GenerationBackend backend, StructuredResponseParser parser) {
        this.backend = backend;
        this.parser = parser;
    }

    @Override
    public UnitName name() { return UnitName.SUPPLY_CHAIN_ADVISOR; }

    @Override
    public Mono<AnalysisResult> run(AnalysisRequest request) {
        RequestValidation.requirePresent(request, name(), "product_name");

        String productName = request.text("product_name", "Unknown");
        log.info("[SupplyChainAdvisor] Creating supply chain strategy product={}", productName);

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
            Create a comprehensive supply chain and manufacturing strategy:

            Product Information:
            - Name: %s
            - Category: %s
            - Target Monthly Volume: %s units
            - Quality Requirements: %s
            - Specifications: %s
            - Target Production Cost: $%s
            - Target Market: %s

            Provide detailed supply chain analysis in JSON:
            {
              "manufacturing_recommendations": {"primary_method": "in-house|fason|dropshipping|hybrid",
                                                "method_rationale": "string", "scalability_score": 0-100},
              "supplier_recommendations": [{"region": "string", "estimated_moq": "string",
                                            "unit_cost_range": "min-max USD", "lead_time_days": "range",
                                            "recommended": true}],
              "cost_analysis": {"per_unit_breakdown": {"raw_materials": 0.0, "manufacturing": 0.0,
                                                       "packaging": 0.0, "total_cogs": 0.0},
                                "cost_optimization_opportunities": ["..."]},
              "production_timeline": {"total_lead_time": 0},
              "logistics_strategy": {"warehousing": {"strategy": "string"}},
              "quality_control": {"quality_checkpoints": ["..."]},
              "recommendations": ["..."],
              "confidence_score": 0-100
            }
            """.formatted(
                request.text("product_name", "Unknown"),
                request.text("product_category", ""),
                request.text("target_volume", "1000"),
                request.text("quality_requirements", "standard"),
                request.map("specifications"),
                request.text("target_cost", "0"),
                request.text("target_market", "Global")
            );
    }

    static List<String> reasoningTrace(Map<String, Object> data) {
        double cogs = PayloadReader.number(data, "cost_analysis.per_unit_breakdown.total_cogs", 0);
        return List.of(
            "Recommended manufacturing method: "
                + PayloadReader.text(data, "manufacturing_recommendations.primary_method", "unknown"),
            "Identified " + PayloadReader.list(data, "supplier_recommendations").size() + " potential suppliers",
            String.format(Locale.ROOT, "Estimated COGS: $%.2f per unit", cogs),
            "Total lead time: " + PayloadReader.text(data, "production_timeline.total_lead_time", "N/A") + " days",
            "Found " + PayloadReader.list(data, "cost_analysis.cost_optimization_opportunities").size()
                + " cost optimization opportunities"
        );
    }

    static String buildSummary(Map<String, Object> data, String productName) {
        String suppliers = PayloadReader.mapList(data, "supplier_recommendations").stream()
            .limit(3)
            .map(s -> PayloadReader.text(s, "region", "Unknown region") + " - $"
                + PayloadReader.text(s, "unit_cost_range", "N/A") + " per unit, "
                + PayloadReader.text(s, "lead_time_days", "N/A") + " days lead time")
            .collect(Collectors.joining("\n"));

        return """
            Supply Chain Strategy for %s

            Manufacturing Method: %s
            Cost of Goods Sold: %s per unit
            Total Lead Time: %s days

            Top Supplier Recommendations:
            %s

            Logistics Strategy: %s
            Quality Control: %d checkpoints defined

            Key Recommendations:
            %s"""
            .formatted(
                productName,
                PayloadReader.text(data, "manufacturing_recommendations.primary_method", "N/A").toUpperCase(),
                SummaryFormat.money(PayloadReader.number(data, "cost_analysis.per_unit_breakdown.total_cogs", 0)),
                PayloadReader.text(data, "production_timeline.total_lead_time", "N/A"),
                suppliers.isEmpty() ? "- none provided" : suppliers,
                PayloadReader.text(data, "logistics_strategy.warehousing.strategy", "N/A"),
                PayloadReader.list(data, "quality_control.quality_checkpoints").size(),
                SummaryFormat.bullets(PayloadReader.list(data, "recommendations"), 3)
            ).strip();
    }
}
