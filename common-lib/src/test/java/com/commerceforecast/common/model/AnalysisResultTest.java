package com.commerceforecast.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisResultTest {

    @Test
    @DisplayName("failure carries its error and an empty payload")
    void failureShape() {
        AnalysisResult result = AnalysisResult.failure(UnitName.SALES_STRATEGY, "timeout", null);
        assertFalse(result.succeeded());
        assertEquals("timeout", result.error());
        assertTrue(result.payload().isEmpty());
        assertEquals(TokenUsage.ZERO, result.tokenUsage());
    }

    @Test
    @DisplayName("a success with an error, or a failure without one, is rejected")
    void envelopeInvariant() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisResult(
            UnitName.PRODUCT_ANALYST, true, Map.of(), "", List.of(), 50, 0, null, 0, "oops"));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisResult(
            UnitName.PRODUCT_ANALYST, false, Map.of(), "", List.of(), 50, 0, null, 0, " "));
    }

    @Test
    @DisplayName("confidence is clamped and timing is never negative")
    void clamps() {
        AnalysisResult result = AnalysisResult.success(UnitName.MARKET_PROFILER, Map.of(), "s",
                                                       List.of(), 140, TokenUsage.ZERO)
            .withTiming(-5, -1.0);
        assertEquals(100.0, result.confidence());
        assertEquals(0L, result.durationMs());
        assertEquals(0.0, result.costUsd());
    }
}
