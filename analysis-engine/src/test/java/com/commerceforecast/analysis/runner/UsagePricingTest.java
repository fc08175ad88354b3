package com.commerceforecast.analysis.runner;

import com.commerceforecast.common.model.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsagePricingTest {

    @Test
    @DisplayName("1M prompt + 1M completion tokens cost 40 USD at default prices")
    void defaultPrices() {
        assertEquals(40.0, UsagePricing.DEFAULT.cost(new TokenUsage(1_000_000, 1_000_000)), 1e-9);
    }

    @Test
    @DisplayName("cost rounded to 6 decimals")
    void rounding() {
        // 7 * 10 / 1e6 = 0.00007, 3 * 30 / 1e6 = 0.00009
        assertEquals(0.00016, UsagePricing.DEFAULT.cost(new TokenUsage(7, 3)), 1e-12);
        assertEquals(0.000001, new UsagePricing(1.0, 0.0).cost(new TokenUsage(1, 0)), 1e-12);
    }

    @Test
    @DisplayName("null or zero usage costs nothing")
    void zero() {
        assertEquals(0.0, UsagePricing.DEFAULT.cost(null));
        assertEquals(0.0, UsagePricing.DEFAULT.cost(TokenUsage.ZERO));
    }
}
