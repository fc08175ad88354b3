package com.commerceforecast.common.model;

public enum PriceElasticity {
    ELASTIC,
    NEUTRAL,
    INELASTIC;

    /** premium → INELASTIC, budget → ELASTIC, anything else → NEUTRAL. */
    public static PriceElasticity fromQualityTier(String qualityTier) {
        if (qualityTier == null) return NEUTRAL;
        return switch (qualityTier.trim().toLowerCase()) {
            case "premium" -> INELASTIC;
            case "budget"  -> ELASTIC;
            default        -> NEUTRAL;
        };
    }
}
