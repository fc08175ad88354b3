package com.commerceforecast.common.model;

import java.util.Arrays;

/**
 * The five analysis units of a forecast, in pipeline order.
 *
 * <p>{@code auditKey} is the stable identifier written to the execution log;
 * {@code required} marks units whose failure fails the whole forecast.
 */
public enum UnitName {
    PRODUCT_ANALYST("Product Analyst", "product_analyst", true),
    MARKET_PROFILER("Market Profiler", "market_profiler", true),
    ADVERTISING_PLANNER("Advertising Planner", "advertising_planner", false),
    SUPPLY_CHAIN_ADVISOR("Supply Chain Advisor", "supply_chain_advisor", false),
    SALES_STRATEGY("Sales Strategy Agent", "sales_strategy", false);

    private final String displayName;
    private final String auditKey;
    private final boolean required;

    UnitName(String displayName, String auditKey, boolean required) {
        this.displayName = displayName;
        this.auditKey = auditKey;
        this.required = required;
    }

    public String displayName() { return displayName; }

    public String auditKey() { return auditKey; }

    public boolean isRequired() { return required; }

    /**
     * Resolves an audit key back to its unit. Returns null for unknown keys.
     */
    public static UnitName fromAuditKey(String auditKey) {
        return Arrays.stream(values())
            .filter(u -> u.auditKey.equals(auditKey))
            .findFirst()
            .orElse(null);
    }
}
