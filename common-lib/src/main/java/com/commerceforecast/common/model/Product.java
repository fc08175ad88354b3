package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Product under forecast, as supplied by the persistence layer. Read-only for the pipeline.
 */
public record Product(
    @JsonProperty("id")               String id,
    @JsonProperty("name")             String name,
    @JsonProperty("description")      String description,
    @JsonProperty("category")         String category,
    @JsonProperty("basePrice")        double basePrice,
    @JsonProperty("currency")         String currency,
    @JsonProperty("productionMethod") String productionMethod,
    @JsonProperty("qualityTier")      String qualityTier,
    @JsonProperty("specifications")   Map<String, Object> specifications
) {
    public Product {
        specifications = specifications == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(specifications));
        currency       = currency == null ? "USD" : currency;
    }

    public static Product of(String id, String name, String category, double basePrice) {
        return new Product(id, name, null, category, basePrice, "USD", null, null, Map.of());
    }
}
