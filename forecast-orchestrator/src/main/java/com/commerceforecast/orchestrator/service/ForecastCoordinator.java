package com.commerceforecast.orchestrator.service;

import com.commerceforecast.analysis.backend.GenerationProperties;
import com.commerceforecast.analysis.runner.UnitRunner;
import com.commerceforecast.analysis.unit.AnalysisUnit;
import com.commerceforecast.common.exception.InvalidRequestException;
import com.commerceforecast.common.exception.RequiredStageFailureException;
import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ForecastOutcome;
import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.model.ForecastStatus;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.ScoreSet;
import com.commerceforecast.common.model.UnitName;
import com.commerceforecast.common.scoring.ScoringEngine;
import com.commerceforecast.common.trace.ForecastContext;
import com.commerceforecast.orchestrator.logger.ForecastFlowLogger;
import com.commerceforecast.orchestrator.persistence.ForecastStore;
import com.commerceforecast.orchestrator.pipeline.StageRequestFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the staged forecast pipeline for one product across a set of cities.
 *
 * <pre>
 *   1. Product analysis        (required)
 *   2. Market profiling        (required, reads stage 1)
 *   3. Advertising | Supply chain | Sales   (concurrent, optional, read stages 1–2)
 *   4. Scoring and aggregation
 * </pre>
 *
 * A failed required stage ends the run with a {@code FAILED} record and
 * {@code success=false}. A failed advisory unit only leaves its section empty.
 * {@link InvalidRequestException} marks the record failed and is re-emitted unchanged;
 * persistence errors propagate as-is.
 */
@Service
public class ForecastCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ForecastCoordinator.class);

    static final String SOURCE = "ForecastCoordinator";

    private final UnitRunner runner;
    private final Map<UnitName, AnalysisUnit> units;
    private final StageRequestFactory requests;
    private final ScoringEngine scoringEngine;
    private final ForecastStore store;
    private final ForecastFlowLogger flowLogger;
    private final Clock clock;
    private final String modelVersion;

    public ForecastCoordinator(UnitRunner runner,
                               List<AnalysisUnit> units,
                               StageRequestFactory requests,
                               ScoringEngine scoringEngine,
                               ForecastStore store,
                               ForecastFlowLogger flowLogger,
                               Clock clock,
                               GenerationProperties generationProperties) {
        this.runner = runner;
        this.units = new EnumMap<>(UnitName.class);
        units.forEach(unit -> this.units.put(unit.name(), unit));
        for (UnitName name : UnitName.values()) {
            if (!this.units.containsKey(name)) {
                throw new IllegalStateException("No analysis unit registered for " + name);
            }
        }
        this.requests = requests;
        this.scoringEngine = scoringEngine;
        this.store = store;
        this.flowLogger = flowLogger;
        this.clock = clock;
        this.modelVersion = generationProperties.getModel();
    }

    /**
     * Loads the product and cities, registers a pending forecast and runs it.
     * Emits {@link InvalidRequestException} when the product does not exist.
     */
    public Mono<ForecastOutcome> requestForecast(String productId, List<String> cityIds) {
        return store.loadProduct(productId)
            .switchIfEmpty(Mono.error(() -> new InvalidRequestException(SOURCE, "Product not found: " + productId)))
            .zipWith(store.loadCities(cityIds))
            .flatMap(loaded -> createForecast(loaded.getT1(), loaded.getT2()));
    }

    public Mono<ForecastOutcome> createForecast(Product product, List<City> cities) {
        return store.createPending(product.id())
            .flatMap(pending -> run(pending, product, cities));
    }

    /** Runs a forecast the caller has already registered as {@code PENDING} under {@code forecastId}. */
    public Mono<ForecastOutcome> createForecast(String forecastId, Product product, List<City> cities) {
        return Mono.defer(() -> run(ForecastRecord.pending(forecastId, product.id()), product, cities));
    }

    private Mono<ForecastOutcome> run(ForecastRecord pending, Product product, List<City> cities) {
        String forecastId = pending.forecastId();
        Mono<ForecastOutcome> pipeline = Mono.defer(() -> {
            log.info("[ForecastCoordinator] Forecast started. forecastId={} productId={} cities={}",
                forecastId, product.id(), cities.size());
            return store.save(pending.processing(clock.instant(), modelVersion))
                .doOnEach(flowLogger.stage(ForecastFlowLogger.FORECAST_REQUESTED))
                .flatMap(processing -> runStages(processing, product, cities)
                    .onErrorResume(RequiredStageFailureException.class, e ->
                        Mono.just(processing.aggregate(e.getResults()).failed(e.getReason(), clock.instant())))
                    .onErrorResume(InvalidRequestException.class, e -> {
                        log.error("[ForecastCoordinator] Invalid request. forecastId={} error={}",
                            forecastId, e.getMessage());
                        return store.save(processing.failed(e.getMessage(), clock.instant()))
                            .doOnNext(flowLogger::logOutcome)
                            .then(Mono.<ForecastRecord>error(e));
                    }))
                .flatMap(store::save)
                .doOnNext(flowLogger::logOutcome)
                .map(record -> record.status() == ForecastStatus.COMPLETED
                    ? ForecastOutcome.completed(record)
                    : ForecastOutcome.failed(record));
        });
        return ForecastContext.bind(pipeline, forecastId);
    }

    private Mono<ForecastRecord> runStages(ForecastRecord processing, Product product, List<City> cities) {
        String forecastId = processing.forecastId();
        return runner.execute(units.get(UnitName.PRODUCT_ANALYST), requests.productRequest(product), forecastId)
            .flatMap(productResult -> requireSucceeded(productResult, List.of(productResult)))
            .doOnEach(flowLogger.stage(ForecastFlowLogger.PRODUCT_ANALYZED))
            .flatMap(productResult -> runner.execute(units.get(UnitName.MARKET_PROFILER),
                    requests.marketRequest(product, cities, productResult), forecastId)
                .flatMap(marketResult -> requireSucceeded(marketResult, List.of(productResult, marketResult)))
                .doOnEach(flowLogger.stage(ForecastFlowLogger.MARKET_PROFILED))
                .flatMap(marketResult -> runAdvisoryUnits(product, productResult, marketResult, forecastId)
                    .doOnEach(flowLogger.stage(ForecastFlowLogger.ADVISORY_UNITS_COMPLETED))
                    .map(advisory -> {
                        ScoreSet scores = scoringEngine.score(productResult.payload(), marketResult.payload(), cities);
                        flowLogger.logStage(ForecastFlowLogger.SCORES_CALCULATED, forecastId);

                        List<AnalysisResult> all = new ArrayList<>();
                        all.add(productResult);
                        all.add(marketResult);
                        all.addAll(advisory);
                        return processing.aggregate(all).completed(scores, clock.instant());
                    })));
    }

    private Mono<AnalysisResult> requireSucceeded(AnalysisResult result, List<AnalysisResult> gathered) {
        if (result.succeeded()) {
            return Mono.just(result);
        }
        String reason = switch (result.unitName()) {
            case PRODUCT_ANALYST -> "Product analysis failed: " + result.error();
            case MARKET_PROFILER -> "Market analysis failed: " + result.error();
            default -> result.unitName().displayName() + " failed: " + result.error();
        };
        log.warn("[ForecastCoordinator] Required stage failed. unit={} error={}",
            result.unitName().auditKey(), result.error());
        return Mono.error(new RequiredStageFailureException(result.unitName(), reason, gathered));
    }

    // ── Stage 3 ──

    /**
     * Runs the three advisory units concurrently and waits for all of them. Each branch
     * resolves to a result even on failure, so no sibling is cancelled; only an
     * {@link InvalidRequestException} is propagated, after the others have finished.
     */
    private Mono<List<AnalysisResult>> runAdvisoryUnits(Product product, AnalysisResult productResult,
                                                        AnalysisResult marketResult, String forecastId) {
        Mono<AnalysisResult> advertising = advisory(UnitName.ADVERTISING_PLANNER,
            requests.advertisingRequest(product, marketResult), forecastId);
        Mono<AnalysisResult> supplyChain = advisory(UnitName.SUPPLY_CHAIN_ADVISOR,
            requests.supplyChainRequest(product, marketResult), forecastId);
        Mono<AnalysisResult> sales = advisory(UnitName.SALES_STRATEGY,
            requests.salesRequest(product, productResult, marketResult), forecastId);

        return Mono.zipDelayError(advertising, supplyChain, sales)
            .onErrorMap(Exceptions::isMultiple, e -> Exceptions.unwrapMultiple(e).get(0))
            .map(t -> List.of(t.getT1(), t.getT2(), t.getT3()));
    }

    private Mono<AnalysisResult> advisory(UnitName name, AnalysisRequest request, String forecastId) {
        return runner.execute(units.get(name), request, forecastId)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> !(e instanceof InvalidRequestException),
                e -> Mono.just(AnalysisResult.failure(name, String.valueOf(e.getMessage()), null)))
            .doOnNext(result -> {
                if (!result.succeeded()) {
                    log.warn("[ForecastCoordinator] Advisory unit failed, continuing. unit={} forecastId={} error={}",
                        name.auditKey(), forecastId, result.error());
                }
            });
    }
}
