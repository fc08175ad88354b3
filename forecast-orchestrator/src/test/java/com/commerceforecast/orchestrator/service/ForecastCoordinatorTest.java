package com.commerceforecast.orchestrator.service;

import com.commerceforecast.analysis.audit.AuditSink;
import com.commerceforecast.analysis.backend.GenerationProperties;
import com.commerceforecast.analysis.runner.UnitRunner;
import com.commerceforecast.analysis.runner.UnitRunnerProperties;
import com.commerceforecast.analysis.runner.UsagePricing;
import com.commerceforecast.analysis.unit.AnalysisUnit;
import com.commerceforecast.common.exception.BackendException;
import com.commerceforecast.common.exception.ForecastPersistenceException;
import com.commerceforecast.common.exception.InvalidRequestException;
import com.commerceforecast.common.model.AnalysisRequest;
import com.commerceforecast.common.model.AnalysisResult;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.model.ForecastStatus;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.TokenUsage;
import com.commerceforecast.common.model.UnitName;
import com.commerceforecast.common.scoring.WeightedScoringEngine;
import com.commerceforecast.orchestrator.logger.ForecastFlowLogger;
import com.commerceforecast.orchestrator.persistence.InMemoryForecastStore;
import com.commerceforecast.orchestrator.persistence.PersistingAuditSink;
import com.commerceforecast.orchestrator.pipeline.StageRequestFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ForecastCoordinatorTest {

    private static final Product PRODUCT = new Product("p-1", "Linen Throw", "Stonewashed linen blanket",
        "home_textiles", 49.0, "USD", "Handmade", "premium", Map.of("material", "linen"));

    private static final List<City> CITIES = List.of(
        new City("c-1", "Istanbul", "Turkey", 15_000_000L, 12_000.0, 90, 65, 40, 60.0, 80.0),
        new City("c-2", "Ankara", "Turkey", 5_700_000L, 10_000.0, 80, 55, 30, 40.0, 75.0));

    private static final TokenUsage USAGE = new TokenUsage(1000, 500);

    private InMemoryForecastStore store;
    private Map<UnitName, FakeUnit> units;

    /** Unit whose response is scripted per test; records every request it receives. */
    private static final class FakeUnit implements AnalysisUnit {
        final UnitName name;
        final List<AnalysisRequest> requests = new CopyOnWriteArrayList<>();
        final AtomicInteger calls = new AtomicInteger();
        volatile Function<AnalysisRequest, Mono<AnalysisResult>> behaviour;

        FakeUnit(UnitName name, Map<String, Object> payload) {
            this.name = name;
            this.behaviour = request -> Mono.just(AnalysisResult.success(name, payload,
                name.displayName() + " summary", List.of("step"), 80, USAGE));
        }

        @Override
        public UnitName name() { return name; }

        @Override
        public Mono<AnalysisResult> run(AnalysisRequest request) {
            calls.incrementAndGet();
            requests.add(request);
            return behaviour.apply(request);
        }
    }

    /** Advances two seconds on every read, so start and completion are always distinct. */
    private static final class SteppingClock extends Clock {
        private Instant next = Instant.parse("2026-03-01T10:00:00Z");

        @Override
        public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override
        public Clock withZone(ZoneId zone) { return this; }

        @Override
        public synchronized Instant instant() {
            Instant current = next;
            next = next.plusSeconds(2);
            return current;
        }
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryForecastStore().withProduct(PRODUCT);
        CITIES.forEach(store::withCity);

        units = new EnumMap<>(UnitName.class);
        units.put(UnitName.PRODUCT_ANALYST, new FakeUnit(UnitName.PRODUCT_ANALYST, Map.of(
            "demand_analysis", Map.of("demand_score", 80, "target_demographics", List.of("Millennials")),
            "quality_assessment", Map.of("quality_score", 70, "quality_tier", "premium"),
            "market_fit", Map.of("market_fit_score", 75, "unique_selling_points", List.of("Organic linen")),
            "pricing_analysis", Map.of("optimal_price_range", "$40-60"))));
        units.put(UnitName.MARKET_PROFILER, new FakeUnit(UnitName.MARKET_PROFILER, Map.of(
            "city_rankings", List.of(
                Map.of("city_name", "Istanbul", "overall_score", 85, "market_size_score", 90,
                       "competition_score", 40, "purchasing_power_score", 70),
                Map.of("city_name", "Ankara", "overall_score", 70)),
            "demographic_insights", Map.of("age", "25-40"),
            "competitive_landscape", Map.of("competition_intensity", "high"),
            "overall_market_assessment", Map.of("market_maturity", "growing", "entry_difficulty", "moderate"))));
        units.put(UnitName.ADVERTISING_PLANNER, new FakeUnit(UnitName.ADVERTISING_PLANNER,
            Map.of("campaign_strategy", Map.of("primary_objective", "conversion"))));
        units.put(UnitName.SUPPLY_CHAIN_ADVISOR, new FakeUnit(UnitName.SUPPLY_CHAIN_ADVISOR,
            Map.of("supplier_recommendations", List.of())));
        units.put(UnitName.SALES_STRATEGY, new FakeUnit(UnitName.SALES_STRATEGY,
            Map.of("sales_channels", List.of(Map.of("channel", "Amazon")))));
    }

    private ForecastCoordinator coordinator() {
        GenerationProperties generation = new GenerationProperties();
        generation.setModel("claude-test");
        List<AuditSink> sinks = List.of(new PersistingAuditSink(store));
        UnitRunner runner = new UnitRunner(sinks, new UnitRunnerProperties(), UsagePricing.DEFAULT,
            new ObjectMapper(), generation.getModel());
        return new ForecastCoordinator(runner, List.copyOf(units.values()), new StageRequestFactory(),
            new WeightedScoringEngine(), store, new ForecastFlowLogger(), new SteppingClock(), generation);
    }

    private void failWith(UnitName unit, String message) {
        units.get(unit).behaviour = request -> Mono.error(new BackendException(unit.displayName(), message));
    }

    private ForecastRecord stored(String forecastId) {
        return store.forecasts.get(forecastId);
    }

    // ── construction ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("rejects a unit set missing one of the five units")
    void requiresAllUnits() {
        units.remove(UnitName.SALES_STRATEGY);
        IllegalStateException e = assertThrows(IllegalStateException.class, this::coordinator);
        assertTrue(e.getMessage().contains("SALES_STRATEGY"));
    }

    // ── happy path ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("all units succeed")
    class AllSucceed {

        @Test
        @DisplayName("forecast completes with every section, scores and summed usage")
        void completes() {
            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    assertNull(outcome.error());
                    ForecastRecord record = outcome.forecastData();
                    assertEquals(ForecastStatus.COMPLETED, record.status());
                    for (UnitName unit : UnitName.values()) {
                        assertNotNull(record.section(unit), unit + " section");
                    }
                    assertNotNull(record.scores());
                    assertEquals(7500, record.tokensUsed());
                    assertEquals(0.125, record.costUsd(), 1e-9);
                    assertEquals("claude-test", record.modelVersion());
                    assertNull(record.errorMessage());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("record moves pending → processing → completed and is persisted each time")
        void lifecycleIsPersisted() {
            String id = coordinator().createForecast(PRODUCT, CITIES).block().forecastId();

            List<ForecastStatus> statuses = store.history.stream()
                .filter(r -> r.forecastId().equals(id))
                .map(ForecastRecord::status)
                .toList();
            assertEquals(List.of(ForecastStatus.PENDING, ForecastStatus.PROCESSING, ForecastStatus.COMPLETED),
                statuses);
            assertEquals(ForecastStatus.COMPLETED, stored(id).status());
        }

        @Test
        @DisplayName("processing timestamps come from the injected clock")
        void durationStamped() {
            ForecastRecord record = coordinator().createForecast(PRODUCT, CITIES).block().forecastData();

            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), record.processingStartedAt());
            assertEquals(Instant.parse("2026-03-01T10:00:02Z"), record.processingCompletedAt());
            assertEquals(2.0, record.processingDurationSeconds(), 1e-9);
        }

        @Test
        @DisplayName("one audit entry per unit execution, keyed by forecast id")
        void auditsEveryUnit() {
            String id = coordinator().createForecast(PRODUCT, CITIES).block().forecastId();

            assertEquals(5, store.audits.size());
            assertTrue(store.audits.stream().allMatch(a -> a.forecastId().equals(id) && a.succeeded()));
            assertTrue(store.audits.stream().allMatch(a -> "claude-test".equals(a.modelName())));
        }

        @Test
        @DisplayName("later stages receive inputs derived from earlier payloads")
        void stageInputsChained() {
            coordinator().createForecast(PRODUCT, CITIES).block();

            AnalysisRequest market = units.get(UnitName.MARKET_PROFILER).requests.get(0);
            assertEquals(List.of("Millennials"), market.list("target_demographics"));
            assertEquals(2, market.list("cities").size());

            AnalysisRequest advertising = units.get(UnitName.ADVERTISING_PLANNER).requests.get(0);
            assertEquals("Istanbul", advertising.text("target_city", null));
            assertEquals(Map.of("age", "25-40"), advertising.map("target_demographics"));

            AnalysisRequest supply = units.get(UnitName.SUPPLY_CHAIN_ADVISOR).requests.get(0);
            assertEquals("Istanbul", supply.text("target_market", null));
            assertEquals(14.7, supply.number("target_cost", 0), 1e-9);

            AnalysisRequest sales = units.get(UnitName.SALES_STRATEGY).requests.get(0);
            assertEquals(List.of("Organic linen"), sales.list("unique_selling_points"));
            assertEquals("high", sales.text("competition_level", null));
        }
    }

    // ── required stages ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("required stage failures")
    class RequiredStages {

        @Test
        @DisplayName("product failure fails the forecast and market never runs")
        void productFailure() {
            failWith(UnitName.PRODUCT_ANALYST, "backend unreachable");

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertFalse(outcome.success());
                    assertNull(outcome.forecastData());
                    assertEquals("Product analysis failed: [Product Analyst] backend unreachable", outcome.error());

                    ForecastRecord record = stored(outcome.forecastId());
                    assertEquals(ForecastStatus.FAILED, record.status());
                    assertNull(record.productAnalysis());
                    assertNull(record.scores());
                    assertEquals(0, record.tokensUsed());
                    assertNotNull(record.processingCompletedAt());
                })
                .verifyComplete();

            assertEquals(0, units.get(UnitName.MARKET_PROFILER).calls.get());
            assertEquals(0, units.get(UnitName.SALES_STRATEGY).calls.get());
        }

        @Test
        @DisplayName("product unit completing without a result fails the forecast")
        void productEmpty() {
            units.get(UnitName.PRODUCT_ANALYST).behaviour = request -> Mono.empty();

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertFalse(outcome.success());
                    assertEquals("Product analysis failed: [Product Analyst] Backend returned no response",
                        outcome.error());
                    assertEquals(ForecastStatus.FAILED, stored(outcome.forecastId()).status());
                })
                .verifyComplete();

            assertEquals(0, units.get(UnitName.MARKET_PROFILER).calls.get());
        }

        @Test
        @DisplayName("market failure keeps the product section and skips stage 3")
        void marketFailure() {
            failWith(UnitName.MARKET_PROFILER, "rate limited");

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertFalse(outcome.success());
                    assertTrue(outcome.error().startsWith("Market analysis failed: "));

                    ForecastRecord record = stored(outcome.forecastId());
                    assertEquals(ForecastStatus.FAILED, record.status());
                    assertNotNull(record.productAnalysis());
                    assertNull(record.marketAnalysis());
                    assertEquals(1500, record.tokensUsed());
                })
                .verifyComplete();

            assertEquals(0, units.get(UnitName.ADVERTISING_PLANNER).calls.get());
            assertEquals(0, units.get(UnitName.SUPPLY_CHAIN_ADVISOR).calls.get());
            assertEquals(0, units.get(UnitName.SALES_STRATEGY).calls.get());
        }
    }

    // ── advisory stage ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("advisory stage failures")
    class AdvisoryStage {

        @Test
        @DisplayName("one failed advisory unit leaves the forecast completed without its section")
        void singleFailureTolerated() {
            failWith(UnitName.SUPPLY_CHAIN_ADVISOR, "timeout");

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    ForecastRecord record = outcome.forecastData();
                    assertEquals(ForecastStatus.COMPLETED, record.status());
                    assertNull(record.supplyChain());
                    assertNotNull(record.advertisingStrategy());
                    assertNotNull(record.salesStrategy());
                    assertEquals(6000, record.tokensUsed());
                    assertEquals(0.1, record.costUsd(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("advisory unit completing without a result still lets the forecast complete")
        void advisoryEmpty() {
            units.get(UnitName.SALES_STRATEGY).behaviour = request -> Mono.empty();

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    ForecastRecord record = outcome.forecastData();
                    assertEquals(ForecastStatus.COMPLETED, record.status());
                    assertNull(record.salesStrategy());
                    assertNotNull(record.scores());
                    assertEquals(6000, record.tokensUsed());
                })
                .verifyComplete();

            List<ForecastStatus> statuses = store.history.stream().map(ForecastRecord::status).toList();
            assertEquals(ForecastStatus.COMPLETED, statuses.get(statuses.size() - 1));
        }

        @Test
        @DisplayName("all advisory units failing still completes with scores")
        void allAdvisoryFail() {
            failWith(UnitName.ADVERTISING_PLANNER, "down");
            failWith(UnitName.SUPPLY_CHAIN_ADVISOR, "down");
            failWith(UnitName.SALES_STRATEGY, "down");

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    assertNotNull(outcome.forecastData().scores());
                    assertEquals(3000, outcome.forecastData().tokensUsed());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a fast failure does not cancel a slower sibling")
        void stragglersAwaited() {
            failWith(UnitName.ADVERTISING_PLANNER, "down");
            FakeUnit sales = units.get(UnitName.SALES_STRATEGY);
            Function<AnalysisRequest, Mono<AnalysisResult>> original = sales.behaviour;
            sales.behaviour = request -> Mono.delay(Duration.ofMillis(150)).then(original.apply(request));

            StepVerifier.create(coordinator().createForecast(PRODUCT, CITIES))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    assertNull(outcome.forecastData().advertisingStrategy());
                    assertNotNull(outcome.forecastData().salesStrategy());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("failed advisory execution is still audited")
        void failureAudited() {
            failWith(UnitName.SALES_STRATEGY, "down");

            coordinator().createForecast(PRODUCT, CITIES).block();

            assertTrue(store.audits.stream().anyMatch(a ->
                a.unit() == UnitName.SALES_STRATEGY && !a.succeeded() && "failed".equals(a.status())));
        }
    }

    // ── fatal errors ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fatal errors")
    class Fatal {

        @Test
        @DisplayName("invalid request marks the record failed and re-emits the exception")
        void invalidRequest() {
            units.get(UnitName.MARKET_PROFILER).behaviour = request -> {
                throw new InvalidRequestException(UnitName.MARKET_PROFILER.displayName(),
                    "No cities provided for analysis");
            };

            StepVerifier.create(coordinator().createForecast("f-invalid", PRODUCT, List.of()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(InvalidRequestException.class, e);
                    assertEquals("[Market Profiler] No cities provided for analysis", e.getMessage());
                })
                .verify();

            ForecastRecord record = stored("f-invalid");
            assertEquals(ForecastStatus.FAILED, record.status());
            assertEquals("[Market Profiler] No cities provided for analysis", record.errorMessage());
        }

        @Test
        @DisplayName("persistence failure propagates as ForecastPersistenceException")
        void persistenceFailure() {
            store.failSaves();

            StepVerifier.create(coordinator().createForecast("f-db", PRODUCT, CITIES))
                .expectError(ForecastPersistenceException.class)
                .verify();

            assertEquals(0, units.get(UnitName.PRODUCT_ANALYST).calls.get());
        }
    }

    // ── requestForecast ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("requestForecast")
    class RequestForecast {

        @Test
        @DisplayName("loads product and cities then runs the pipeline")
        void loadsAndRuns() {
            StepVerifier.create(coordinator().requestForecast("p-1", List.of("c-2", "c-1")))
                .assertNext(outcome -> {
                    assertTrue(outcome.success());
                    assertEquals("p-1", outcome.forecastData().productId());
                })
                .verifyComplete();

            List<Object> cities = units.get(UnitName.MARKET_PROFILER).requests.get(0).list("cities");
            assertEquals("Ankara", ((Map<?, ?>) cities.get(0)).get("name"));
        }

        @Test
        @DisplayName("unknown product is an invalid request and registers nothing")
        void unknownProduct() {
            StepVerifier.create(coordinator().requestForecast("missing", List.of("c-1")))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(InvalidRequestException.class, e);
                    assertTrue(e.getMessage().contains("Product not found: missing"));
                })
                .verify();

            assertTrue(store.forecasts.isEmpty());
        }
    }
}
