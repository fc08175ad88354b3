package com.commerceforecast.common.exception;

import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.UnitName;

import java.util.List;

/**
 * A required unit (product or market) failed; the forecast cannot continue.
 *
 * <p>{@link #getReason()} is the unprefixed text stored as the forecast's error message.
 * {@link #getResults()} holds every unit result gathered before the failure, the failed
 * one included, so the failed record can still show what did complete.
 */
public class RequiredStageFailureException extends ForecastException {
    private final UnitName unit;
    private final String reason;
    private final List<AnalysisResult> results;

    public RequiredStageFailureException(UnitName unit, String reason, List<AnalysisResult> results) {
        super(unit.displayName(), reason);
        this.unit = unit;
        this.reason = reason;
        this.results = results == null ? List.of() : List.copyOf(results);
    }

    public UnitName getUnit() {
        return unit;
    }

    public String getReason() {
        return reason;
    }

    public List<AnalysisResult> getResults() {
        return results;
    }
}
