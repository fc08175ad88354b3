package com.commerceforecast.analysis.runner;

import com.commerceforecast.common.model.TokenUsage;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-million-token prices used to cost a unit run. Cost is rounded to 6 decimals.
 */
public record UsagePricing(double promptUsdPerMillion, double completionUsdPerMillion) {

    public static final UsagePricing DEFAULT = new UsagePricing(10.0, 30.0);

    public double cost(TokenUsage usage) {
        if (usage == null) return 0.0;
        double raw = usage.promptTokens() / 1_000_000.0 * promptUsdPerMillion
                   + usage.completionTokens() / 1_000_000.0 * completionUsdPerMillion;
        return BigDecimal.valueOf(raw).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }
}
