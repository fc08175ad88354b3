package com.commerceforecast.analysis.unit;

import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.UnitName;
import reactor.core.publisher.Mono;

/**
 * Contract for all forecast analysis units.
 *
 * <p>{@link #run} validates the request eagerly and throws
 * {@link com.commerceforecast.common.exception.InvalidRequestException} before any
 * backend call. Backend and parse errors surface as error signals of the returned
 * {@code Mono}. The returned result carries no timing or cost; the
 * {@link com.commerceforecast.analysis.runner.UnitRunner} stamps both.
 */
public interface AnalysisUnit {

    UnitName name();

    Mono<AnalysisResult> run(AnalysisRequest request);
}
