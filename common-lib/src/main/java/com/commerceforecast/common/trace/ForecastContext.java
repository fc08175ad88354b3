package com.commerceforecast.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Tags log lines with the forecast they belong to.
 *
 * <p>Inside a pipeline the forecast id lives in the Reactor Context, written once when the
 * run is assembled. MDC is filled only around a single log call, because advisory units
 * run on {@code boundedElastic} threads that are shared between forecasts.
 *
 * <pre>
 *     return ForecastContext.bind(pipeline, forecastId);
 * </pre>
 */
public final class ForecastContext {

    public static final String FORECAST_ID_KEY = "forecastId";
    public static final String UNIT_KEY = "unit";

    static final String UNKNOWN = "unknown";

    private ForecastContext() {}

    /** Makes {@code forecastId} visible to every operator upstream of this point. */
    public static <T> Mono<T> bind(Mono<T> pipeline, String forecastId) {
        return pipeline.contextWrite(ctx -> ctx.put(FORECAST_ID_KEY, forecastId));
    }

    public static String forecastId(ContextView ctx) {
        return ctx.getOrDefault(FORECAST_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String forecastId, Runnable logAction) {
        withMdc(forecastId, null, logAction);
    }

    /**
     * Runs {@code logAction} with the forecast id, and the unit when given, in MDC.
     * Values already present are restored afterwards, so nested calls keep the outer tags.
     */
    public static void withMdc(String forecastId, String unit, Runnable logAction) {
        String previousForecast = MDC.get(FORECAST_ID_KEY);
        String previousUnit = MDC.get(UNIT_KEY);
        put(FORECAST_ID_KEY, forecastId);
        if (unit != null) {
            MDC.put(UNIT_KEY, unit);
        }
        try {
            logAction.run();
        } finally {
            put(FORECAST_ID_KEY, previousForecast);
            put(UNIT_KEY, previousUnit);
        }
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
