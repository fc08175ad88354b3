package com.commerceforecast.orchestrator.pipeline;

import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.UnitName;
import com.commerceforecast.common.payload.PayloadReader;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds each unit's request from the product, the cities and earlier stage payloads.
 * Every value read from a payload has a default, so a sparse upstream payload never
 * blocks a downstream stage.
 */
@Component
public class StageRequestFactory {

    static final int    TARGET_VOLUME       = 1000;
    static final double TARGET_COST_RATIO   = 0.3;
    static final int    BUDGET_MIN          = 1000;
    static final int    BUDGET_MAX          = 5000;
    static final String CAMPAIGN_OBJECTIVE  = "conversion";
    static final String QUALITY_REQUIREMENT = "standard";

    public AnalysisRequest productRequest(Product product) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_name", product.name());
        fields.put("description", product.description() != null ? product.description() : "");
        fields.put("category", product.category());
        fields.put("base_price", product.basePrice());
        fields.put("production_method", product.productionMethod() != null ? product.productionMethod() : "Not specified");
        fields.put("specifications", product.specifications());
        return AnalysisRequest.of(UnitName.PRODUCT_ANALYST, fields);
    }

    public AnalysisRequest marketRequest(Product product, List<City> cities, AnalysisResult productResult) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_category", product.category());
        fields.put("price_point", product.basePrice());
        fields.put("target_demographics",
            PayloadReader.list(productResult.payload(), "demand_analysis.target_demographics"));
        fields.put("cities", cities.stream().map(StageRequestFactory::cityFields).toList());
        return AnalysisRequest.of(UnitName.MARKET_PROFILER, fields);
    }

    public AnalysisRequest advertisingRequest(Product product, AnalysisResult marketResult) {
        Map<String, Object> market = marketResult.payload();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_name", product.name());
        fields.put("product_category", product.category());
        fields.put("price", product.basePrice());
        fields.put("target_city", topCity(market, "N/A"));
        fields.put("target_demographics", PayloadReader.map(market, "demographic_insights"));
        fields.put("budget_range", Map.of("min", BUDGET_MIN, "max", BUDGET_MAX));
        fields.put("campaign_objective", CAMPAIGN_OBJECTIVE);
        return AnalysisRequest.of(UnitName.ADVERTISING_PLANNER, fields);
    }

    public AnalysisRequest supplyChainRequest(Product product, AnalysisResult marketResult) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_name", product.name());
        fields.put("product_category", product.category());
        fields.put("specifications", product.specifications());
        fields.put("target_volume", TARGET_VOLUME);
        fields.put("quality_requirements", QUALITY_REQUIREMENT);
        fields.put("target_cost", product.basePrice() * TARGET_COST_RATIO);
        fields.put("target_market", topCity(marketResult.payload(), "Global"));
        return AnalysisRequest.of(UnitName.SUPPLY_CHAIN_ADVISOR, fields);
    }

    public AnalysisRequest salesRequest(Product product, AnalysisResult productResult, AnalysisResult marketResult) {
        Map<String, Object> market = marketResult.payload();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_name", product.name());
        fields.put("price", product.basePrice());
        fields.put("product_category", product.category());
        fields.put("target_audience", PayloadReader.map(market, "demographic_insights"));
        fields.put("unique_selling_points",
            PayloadReader.list(productResult.payload(), "market_fit.unique_selling_points"));
        fields.put("competition_level",
            PayloadReader.text(market, "competitive_landscape.competition_intensity", "moderate"));
        return AnalysisRequest.of(UnitName.SALES_STRATEGY, fields);
    }

    static String topCity(Map<String, Object> marketPayload, String fallback) {
        return PayloadReader.text(PayloadReader.first(marketPayload, "city_rankings"), "city_name", fallback);
    }

    private static Map<String, Object> cityFields(City city) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", city.name());
        fields.put("country", city.country());
        fields.put("population", city.population());
        fields.put("gdp_per_capita", city.gdpPerCapita());
        fields.put("purchasing_power_index", city.purchasingPowerIndex());
        fields.put("ecommerce_penetration", city.ecommercePenetration());
        fields.put("competition_density", city.competitionDensity());
        fields.put("average_order_value", city.averageOrderValue());
        fields.put("internet_penetration", city.internetPenetration());
        return fields;
    }
}
