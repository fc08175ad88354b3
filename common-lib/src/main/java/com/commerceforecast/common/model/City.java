package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Demographic and economic record of a target city. Never mutated by the pipeline.
 */
public record City(
    @JsonProperty("id")                   String id,
    @JsonProperty("name")                 String name,
    @JsonProperty("country")              String country,
    @JsonProperty("population")           long population,
    @JsonProperty("gdpPerCapita")         Double gdpPerCapita,
    @JsonProperty("purchasingPowerIndex") double purchasingPowerIndex,
    @JsonProperty("ecommercePenetration") double ecommercePenetration,
    @JsonProperty("competitionDensity")   double competitionDensity,
    @JsonProperty("averageOrderValue")    Double averageOrderValue,
    @JsonProperty("internetPenetration")  Double internetPenetration
) {
    public static City of(String id, String name, String country, long population) {
        return new City(id, name, country, population, null, 100.0, 50.0, 50.0, null, null);
    }
}
