package com.commerceforecast.orchestrator.pipeline;

import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.TokenUsage;
import com.commerceforecast.common.model.UnitName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageRequestFactoryTest {

    private final StageRequestFactory factory = new StageRequestFactory();

    private static final Product PRODUCT = new Product("p-1", "Linen Throw", null, "home_textiles",
        50.0, "USD", null, "premium", Map.of("material", "linen"));

    private static AnalysisResult result(UnitName unit, Map<String, Object> payload) {
        return AnalysisResult.success(unit, payload, "", List.of(), 75, TokenUsage.ZERO);
    }

    private static final AnalysisResult EMPTY_MARKET = result(UnitName.MARKET_PROFILER, Map.of());
    private static final AnalysisResult EMPTY_PRODUCT = result(UnitName.PRODUCT_ANALYST, Map.of());

    @Test
    @DisplayName("product request fills optional text fields with defaults")
    void productDefaults() {
        AnalysisRequest request = factory.productRequest(PRODUCT);

        assertEquals(UnitName.PRODUCT_ANALYST, request.unit());
        assertEquals("Linen Throw", request.text("product_name", null));
        assertEquals("", request.text("description", null));
        assertEquals("Not specified", request.text("production_method", null));
        assertEquals(50.0, request.number("base_price", 0));
        assertEquals(Map.of("material", "linen"), request.map("specifications"));
    }

    @Test
    @DisplayName("market request carries every city with snake_case metrics")
    void marketCities() {
        City city = new City("c-1", "Istanbul", "Turkey", 15_000_000L, 12_000.0, 90, 65, 40, 60.0, 80.0);
        AnalysisResult product = result(UnitName.PRODUCT_ANALYST,
            Map.of("demand_analysis", Map.of("target_demographics", List.of("Millennials", "Gen Z"))));

        AnalysisRequest request = factory.marketRequest(PRODUCT, List.of(city), product);

        assertEquals(List.of("Millennials", "Gen Z"), request.list("target_demographics"));
        Map<?, ?> fields = (Map<?, ?>) request.list("cities").get(0);
        assertEquals("Istanbul", fields.get("name"));
        assertEquals(15_000_000L, fields.get("population"));
        assertEquals(65.0, fields.get("ecommerce_penetration"));
        assertEquals(60.0, fields.get("average_order_value"));
    }

    @Test
    @DisplayName("missing product demographics default to an empty list")
    void marketDemographicsDefault() {
        AnalysisRequest request = factory.marketRequest(PRODUCT, List.of(), EMPTY_PRODUCT);

        assertEquals(List.of(), request.list("target_demographics"));
    }

    @Test
    @DisplayName("advisory requests fall back when the market payload is empty")
    void advisoryDefaults() {
        AnalysisRequest advertising = factory.advertisingRequest(PRODUCT, EMPTY_MARKET);
        assertEquals("N/A", advertising.text("target_city", null));
        assertEquals(Map.of(), advertising.map("target_demographics"));
        assertEquals(Map.of("min", 1000, "max", 5000), advertising.map("budget_range"));
        assertEquals("conversion", advertising.text("campaign_objective", null));

        AnalysisRequest supply = factory.supplyChainRequest(PRODUCT, EMPTY_MARKET);
        assertEquals("Global", supply.text("target_market", null));
        assertEquals(1000, supply.number("target_volume", 0));
        assertEquals(15.0, supply.number("target_cost", 0), 1e-9);
        assertEquals("standard", supply.text("quality_requirements", null));

        AnalysisRequest sales = factory.salesRequest(PRODUCT, EMPTY_PRODUCT, EMPTY_MARKET);
        assertEquals("moderate", sales.text("competition_level", null));
        assertEquals(List.of(), sales.list("unique_selling_points"));
        assertEquals(Map.of(), sales.map("target_audience"));
    }

    @Test
    @DisplayName("top city is the first ranking entry")
    void topCity() {
        Map<String, Object> market = Map.of("city_rankings", List.of(
            Map.of("city_name", "Ankara", "overall_score", 90),
            Map.of("city_name", "Istanbul", "overall_score", 95)));

        assertEquals("Ankara", StageRequestFactory.topCity(market, "N/A"));
        assertEquals("N/A", StageRequestFactory.topCity(Map.of("city_rankings", List.of()), "N/A"));
    }
}
