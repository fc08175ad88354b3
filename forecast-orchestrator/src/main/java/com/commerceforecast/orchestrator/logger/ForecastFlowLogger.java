package com.commerceforecast.orchestrator.logger;

import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.trace.ForecastContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each lifecycle stage of a forecast run. Pure side effects; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #FORECAST_REQUESTED}: pipeline subscribed, record moved to processing</li>
 *   <li>{@link #PRODUCT_ANALYZED}: product unit succeeded</li>
 *   <li>{@link #MARKET_PROFILED}: market unit succeeded</li>
 *   <li>{@link #ADVISORY_UNITS_COMPLETED}: all three advisory units reached a terminal state</li>
 *   <li>{@link #SCORES_CALCULATED}: scoring engine produced the score set</li>
 *   <li>{@link #FORECAST_COMPLETED} or {@link #FORECAST_FAILED}</li>
 * </ol>
 *
 * <p>With {@code doOnEach} the forecast id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(ForecastFlowLogger.PRODUCT_ANALYZED))
 * </pre>
 */
@Component
public class ForecastFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ForecastFlowLogger.class);

    public static final String FORECAST_REQUESTED       = "FORECAST_REQUESTED";
    public static final String PRODUCT_ANALYZED         = "PRODUCT_ANALYZED";
    public static final String MARKET_PROFILED          = "MARKET_PROFILED";
    public static final String ADVISORY_UNITS_COMPLETED = "ADVISORY_UNITS_COMPLETED";
    public static final String SCORES_CALCULATED        = "SCORES_CALCULATED";
    public static final String FORECAST_COMPLETED       = "FORECAST_COMPLETED";
    public static final String FORECAST_FAILED          = "FORECAST_FAILED";

    /**
     * Returns a {@code doOnEach} consumer for {@code stageName}. Fires on {@code onNext}
     * only; the forecast id comes from the signal's context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            logStage(stageName, ForecastContext.forecastId(signal.getContextView()));
        };
    }

    /** For stages reached outside a signal, such as scoring inside a {@code map}. */
    public void logStage(String stageName, String forecastId) {
        ForecastContext.withMdc(forecastId, () ->
            log.info("[ForecastFlow] stage={} forecastId={}", stageName, forecastId)
        );
    }

    /** One line per finished run: terminal status, usage and duration. */
    public void logOutcome(ForecastRecord record) {
        String stageName = record.errorMessage() == null ? FORECAST_COMPLETED : FORECAST_FAILED;
        ForecastContext.withMdc(record.forecastId(), () -> {
            if (record.errorMessage() == null) {
                log.info("[ForecastFlow] stage={} forecastId={} status={} durationSeconds={} tokens={} costUsd={} overallScore={}",
                    stageName, record.forecastId(), record.status(), record.processingDurationSeconds(),
                    record.tokensUsed(), record.costUsd(),
                    record.scores() != null ? record.scores().overallScore() : "N/A");
            } else {
                log.warn("[ForecastFlow] stage={} forecastId={} status={} durationSeconds={} error={}",
                    stageName, record.forecastId(), record.status(), record.processingDurationSeconds(),
                    record.errorMessage());
            }
        });
    }
}
