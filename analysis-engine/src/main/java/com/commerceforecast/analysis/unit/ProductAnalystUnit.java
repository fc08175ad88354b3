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
 * Classifies the product and scores its quality, demand potential, production
 * method and market fit. Its payload feeds the market stage and the scoring engine.
 */
@Component
public class ProductAnalystUnit implements AnalysisUnit {

    private static final Logger log = LoggerFactory.getLogger(ProductAnalystUnit.class);

    static final double TEMPERATURE        = 0.7;
    static final int    MAX_TOKENS         = 3000;
    static final double DEFAULT_CONFIDENCE = 75.0;

    private static final String SYSTEM_PROMPT = """
        You are an expert Product Analyst with deep knowledge of e-commerce product categorization,
        quality assessment, contract manufacturing (FASON) methods, consumer demand patterns and
        competitive positioning.

        Assess product classification, quality tier (premium, standard, budget), production
        complexity, demand potential (0-100), market fit, unique selling points and target segments.
        Always give numerical scores, actionable insights and risk factors.
        Respond in JSON format with structured data.
        """;

    private final GenerationBackend backend;
    private final StructuredResponseParser parser;

    public ProductAnalystUnit(GenerationBackend backend, StructuredResponseParser parser) {
        this.backend = backend;
        this.parser = parser;
    }

    @Override
    public UnitName name() { return UnitName.PRODUCT_ANALYST; }

    @Override
    public Mono<AnalysisResult> run(AnalysisRequest request) {
        RequestValidation.requireText(request, name(), "product_name");

        String productName = request.text("product_name", "Unknown");
        log.info("[ProductAnalyst] Analyzing product={}", productName);

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
            Analyze this product comprehensively:

            Product Information:
            - Name: %s
            - Description: %s
            - Category: %s
            - Base Price: $%s
            - Production Method: %s
            - Specifications: %s

            Provide a detailed analysis in JSON format with this exact structure:
            {
              "product_classification": {"primary_category": "string", "sub_category": "string",
                                         "product_type": "string", "market_segment": "premium|mid-tier|budget"},
              "quality_assessment": {"quality_tier": "premium|standard|budget", "quality_score": 0-100,
                                     "quality_indicators": ["..."], "durability_rating": 0-100,
                                     "perceived_value": "high|medium|low"},
              "demand_analysis": {"demand_score": 0-100, "demand_trend": "rising|stable|declining",
                                  "seasonality": "high|moderate|low", "target_demographics": ["..."],
                                  "use_cases": ["..."], "demand_drivers": ["..."]},
              "production_analysis": {"production_complexity": "simple|moderate|complex",
                                      "recommended_method": "in-house|fason|dropshipping|hybrid",
                                      "fason_suitability_score": 0-100,
                                      "estimated_production_cost_range": "min-max USD",
                                      "lead_time_estimate": "X-Y days"},
              "market_fit": {"market_fit_score": 0-100, "competitive_intensity": "low|medium|high",
                             "differentiation_potential": 0-100, "unique_selling_points": ["..."],
                             "positioning_strategy": "string"},
              "pricing_analysis": {"price_positioning": "premium|competitive|value",
                                   "price_elasticity": "elastic|neutral|inelastic",
                                   "optimal_price_range": "min-max USD",
                                   "profit_margin_potential": "percentage range"},
              "risk_factors": [{"risk": "string", "severity": "high|medium|low", "mitigation": "string"}],
              "opportunities": ["..."],
              "recommendations": ["..."],
              "confidence_score": 0-100,
              "reasoning": "detailed explanation of analysis"
            }

            Be thorough, analytical, and data-driven in your assessment.
            """.formatted(
                request.text("product_name", "Unknown"),
                request.text("description", ""),
                request.text("category", ""),
                request.text("base_price", "0"),
                request.text("production_method", "Not specified"),
                request.map("specifications")
            );
    }

    static List<String> reasoningTrace(Map<String, Object> data) {
        return List.of(
            "Classified product as " + PayloadReader.text(data, "product_classification.primary_category", "unknown"),
            "Quality assessed as " + PayloadReader.text(data, "quality_assessment.quality_tier", "unknown") + " tier",
            "Demand score calculated: " + PayloadReader.text(data, "demand_analysis.demand_score", "N/A") + "/100",
            "Production method recommended: " + PayloadReader.text(data, "production_analysis.recommended_method", "unknown"),
            "Market fit score: " + PayloadReader.text(data, "market_fit.market_fit_score", "N/A") + "/100"
        );
    }

    static String buildSummary(Map<String, Object> data, String productName) {
        double demand    = PayloadReader.number(data, "demand_analysis.demand_score", 0);
        double marketFit = PayloadReader.number(data, "market_fit.market_fit_score", 0);

        String demandLabel = demand >= 70 ? "High" : demand >= 40 ? "Moderate" : "Low";
        String fitLabel    = marketFit >= 80 ? "Excellent" : marketFit >= 60 ? "Good" : "Fair";

        return """
            Product Analysis Summary: %s

            Quality: %s tier product
            Demand Potential: %s/100 - %s demand expected
            Market Fit: %s/100 - %s product-market alignment
            Production: %s recommended

            Key Insights:
            %s

            Opportunities: %d market opportunities identified
            Risks: %d risk factors to address"""
            .formatted(
                productName,
                SummaryFormat.capitalize(PayloadReader.text(data, "quality_assessment.quality_tier", "unknown")),
                SummaryFormat.number(demand), demandLabel,
                SummaryFormat.number(marketFit), fitLabel,
                PayloadReader.text(data, "production_analysis.recommended_method", "unknown").toUpperCase(),
                SummaryFormat.bullets(PayloadReader.list(data, "recommendations"), 3),
                PayloadReader.list(data, "opportunities").size(),
                PayloadReader.list(data, "risk_factors").size()
            ).strip();
    }
}
