package com.commerceforecast.analysis.runner;

import com.commerceforecast.analysis.audit.AuditSink;
import com.commerceforecast.analysis.unit.AnalysisUnit;
import com.commerceforecast.common.exception.BackendException;
import com.commerceforecast.common.exception.InvalidRequestException;
import com.commerceforecast.common.exception.ParseException;
import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.TokenUsage;
import com.commerceforecast.common.model.UnitExecutionAudit;
import com.commerceforecast.common.model.UnitName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one analysis unit and normalises every outcome into an {@link AnalysisResult}.
 *
 * <p>Backend errors, timeouts, empty unit responses, parse errors and unexpected exceptions
 * become failed results carrying the error text; only {@link InvalidRequestException} is re-emitted.
 * Each invocation is timed, costed from the reported token usage and recorded once
 * with every registered {@link AuditSink}. Audit failures are logged and swallowed.
 */
public class UnitRunner {

    private static final Logger log = LoggerFactory.getLogger(UnitRunner.class);

    private final List<AuditSink> auditSinks;
    private final UnitRunnerProperties properties;
    private final UsagePricing pricing;
    private final ObjectMapper objectMapper;
    private final String modelName;

    public UnitRunner(List<AuditSink> auditSinks, UnitRunnerProperties properties,
                      UsagePricing pricing, ObjectMapper objectMapper, String modelName) {
        this.auditSinks = List.copyOf(auditSinks);
        this.properties = properties;
        this.pricing = pricing;
        this.objectMapper = objectMapper;
        this.modelName = modelName;
    }

    public Mono<AnalysisResult> execute(AnalysisUnit unit, AnalysisRequest request, String forecastId) {
        return Mono.defer(() -> {
            Instant startedAt = Instant.now();
            long startNanos = System.nanoTime();
            AtomicInteger attempts = new AtomicInteger();
            Duration timeout = properties.timeoutFor(unit.name());

            Mono<AnalysisResult> attempt = Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return unit.run(request);
                })
                .switchIfEmpty(Mono.error(() -> new BackendException(unit.name().displayName(),
                    "Backend returned no response")))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new BackendException(unit.name().displayName(),
                    "Timed out after " + timeout.toMillis() + "ms", e));

            if (properties.getMaxRetries() > 0) {
                attempt = attempt.retryWhen(Retry.max(properties.getMaxRetries())
                    .filter(BackendException.class::isInstance)
                    .doBeforeRetry(signal -> log.warn("[UnitRunner] Retrying unit={} attempt={} error={}",
                        unit.name().auditKey(), signal.totalRetries() + 2, signal.failure().getMessage()))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
            }

            return attempt
                .onErrorResume(InvalidRequestException.class, e -> {
                    log.error("[UnitRunner] Invalid request for unit={} forecastId={}: {}",
                        unit.name().auditKey(), forecastId, e.getMessage());
                    AnalysisResult rejected = AnalysisResult.failure(unit.name(), e.getMessage(), TokenUsage.ZERO)
                        .withTiming(elapsedMs(startNanos), 0.0);
                    return audit(forecastId, rejected, startedAt, attempts.get())
                        .then(Mono.<AnalysisResult>error(e));
                })
                .onErrorResume(e -> !(e instanceof InvalidRequestException),
                    e -> Mono.just(toFailure(unit.name(), e, forecastId)))
                .map(result -> result.withTiming(elapsedMs(startNanos), pricing.cost(result.tokenUsage())))
                .flatMap(result -> audit(forecastId, result, startedAt, attempts.get()).thenReturn(result));
        });
    }

    private AnalysisResult toFailure(UnitName unit, Throwable e, String forecastId) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        TokenUsage usage = e instanceof ParseException pe ? pe.getUsage() : TokenUsage.ZERO;
        if (e instanceof BackendException || e instanceof ParseException) {
            log.warn("[UnitRunner] unit={} forecastId={} failed: {}", unit.auditKey(), forecastId, error);
        } else {
            log.error("[UnitRunner] unit={} forecastId={} failed unexpectedly", unit.auditKey(), forecastId, e);
        }
        return AnalysisResult.failure(unit, error, usage);
    }

    private Mono<Void> audit(String forecastId, AnalysisResult result, Instant startedAt, int attempts) {
        if (auditSinks.isEmpty()) return Mono.empty();
        UnitExecutionAudit entry = toAudit(forecastId, result, startedAt, Math.max(0, attempts - 1));
        return Flux.fromIterable(auditSinks)
            .flatMap(sink -> Mono.defer(() -> sink.record(entry))
                .onErrorResume(e -> {
                    log.warn("[UnitRunner] Audit sink {} failed for unit={} forecastId={} (non-fatal): {}",
                        sink.getClass().getSimpleName(), result.unitName().auditKey(), forecastId, e.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    UnitExecutionAudit toAudit(String forecastId, AnalysisResult result, Instant startedAt, int retryCount) {
        TokenUsage usage = result.tokenUsage();
        return new UnitExecutionAudit(
            forecastId,
            result.unitName(),
            result.succeeded() ? UnitExecutionAudit.STATUS_COMPLETED : UnitExecutionAudit.STATUS_FAILED,
            result.succeeded(),
            startedAt,
            startedAt.plusMillis(result.durationMs()),
            result.durationMs(),
            usage.promptTokens(),
            usage.completionTokens(),
            usage.total(),
            result.costUsd(),
            result.confidence(),
            result.reasoningTrace(),
            result.summary(),
            truncate(serialize(result)),
            result.error(),
            retryCount,
            modelName
        );
    }

    private String serialize(AnalysisResult result) {
        if (result.payload().isEmpty()) return "";
        try {
            return objectMapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException e) {
            return String.valueOf(result.payload());
        }
    }

    private String truncate(String output) {
        int limit = properties.getOutputTruncation();
        return output.length() <= limit ? output : output.substring(0, limit);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
