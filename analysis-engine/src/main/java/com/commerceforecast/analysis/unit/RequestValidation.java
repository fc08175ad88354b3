package com.commerceforecast.analysis.unit;

import com.commerceforecast.common.exception.InvalidRequestException;
import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.UnitName;

/**
 * Fail-fast checks run by each unit before it calls the backend.
 */
public final class RequestValidation {

    private RequestValidation() {}

    public static void requirePresent(AnalysisRequest request, UnitName unit, String... keys) {
        for (String key : keys) {
            if (!request.has(key)) {
                throw new InvalidRequestException(unit.displayName(), "Missing required field: " + key);
            }
        }
    }

    /** Present and not blank. */
    public static void requireText(AnalysisRequest request, UnitName unit, String key) {
        String value = request.text(key, null);
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(unit.displayName(), "Missing required field: " + key);
        }
    }

    public static void requireNonEmptyList(AnalysisRequest request, UnitName unit, String key, String message) {
        if (request.list(key).isEmpty()) {
            throw new InvalidRequestException(unit.displayName(), message);
        }
    }
}
