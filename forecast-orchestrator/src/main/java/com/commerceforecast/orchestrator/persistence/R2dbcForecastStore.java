package com.commerceforecast.orchestrator.persistence;

import com.commerceforecast.common.exception.ForecastPersistenceException;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.ScoreSet;
import com.commerceforecast.common.model.UnitExecutionAudit;
import com.commerceforecast.common.model.UnitSection;
import com.commerceforecast.orchestrator.persistence.entity.AgentLogEntity;
import com.commerceforecast.orchestrator.persistence.entity.CityEntity;
import com.commerceforecast.orchestrator.persistence.entity.ForecastEntity;
import com.commerceforecast.orchestrator.persistence.entity.ProductEntity;
import com.commerceforecast.orchestrator.persistence.repository.AgentLogRepository;
import com.commerceforecast.orchestrator.persistence.repository.CityRepository;
import com.commerceforecast.orchestrator.persistence.repository.ForecastRepository;
import com.commerceforecast.orchestrator.persistence.repository.ProductRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link ForecastStore} over Spring Data R2DBC repositories. Unit payloads, score
 * rankings and reasoning traces are stored as JSON text columns.
 */
@Component
public class R2dbcForecastStore implements ForecastStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcForecastStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ForecastRepository forecastRepository;
    private final ProductRepository  productRepository;
    private final CityRepository     cityRepository;
    private final AgentLogRepository agentLogRepository;
    private final ObjectMapper       objectMapper;

    public R2dbcForecastStore(ForecastRepository forecastRepository,
                              ProductRepository productRepository,
                              CityRepository cityRepository,
                              AgentLogRepository agentLogRepository,
                              ObjectMapper objectMapper) {
        this.forecastRepository = forecastRepository;
        this.productRepository  = productRepository;
        this.cityRepository     = cityRepository;
        this.agentLogRepository = agentLogRepository;
        this.objectMapper       = objectMapper;
    }

    @Override
    public Mono<Product> loadProduct(String productId) {
        return productRepository.findById(productId)
            .map(this::toProduct)
            .onErrorMap(e -> !(e instanceof ForecastPersistenceException),
                e -> new ForecastPersistenceException("Failed to load product " + productId, e));
    }

    @Override
    public Mono<List<City>> loadCities(List<String> cityIds) {
        if (cityIds == null || cityIds.isEmpty()) return Mono.just(List.of());
        return cityRepository.findAllById(cityIds)
            .collectMap(CityEntity::getId, Function.identity())
            .map(byId -> {
                List<City> ordered = cityIds.stream()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .map(R2dbcForecastStore::toCity)
                    .collect(Collectors.toList());
                if (ordered.size() < cityIds.size()) {
                    log.warn("[ForecastStore] {} of {} requested cities not found", cityIds.size() - ordered.size(),
                        cityIds.size());
                }
                return ordered;
            })
            .onErrorMap(e -> new ForecastPersistenceException("Failed to load cities " + cityIds, e));
    }

    @Override
    public Mono<ForecastRecord> createPending(String productId) {
        ForecastRecord pending = ForecastRecord.pending(UUID.randomUUID().toString(), productId);
        return Mono.fromCallable(() -> {
                ForecastEntity entity = toEntity(pending);
                entity.setNewEntity(true);
                return entity;
            })
            .flatMap(forecastRepository::save)
            .doOnSuccess(e -> log.info("[ForecastStore] Forecast registered. forecastId={} productId={}",
                e.getId(), productId))
            .thenReturn(pending)
            .onErrorMap(e -> !(e instanceof ForecastPersistenceException),
                e -> new ForecastPersistenceException("Failed to create forecast for product " + productId, e));
    }

    @Override
    public Mono<ForecastRecord> save(ForecastRecord record) {
        return Mono.fromCallable(() -> toEntity(record))
            .flatMap(forecastRepository::save)
            .doOnSuccess(e -> log.debug("[ForecastStore] Forecast saved. forecastId={} status={}",
                e.getId(), e.getStatus()))
            .thenReturn(record)
            .onErrorMap(e -> !(e instanceof ForecastPersistenceException),
                e -> new ForecastPersistenceException("Failed to save forecast " + record.forecastId(), e));
    }

    @Override
    public Mono<Void> appendAudit(UnitExecutionAudit audit) {
        return Mono.fromCallable(() -> toEntity(audit))
            .flatMap(agentLogRepository::save)
            .then()
            .onErrorMap(e -> !(e instanceof ForecastPersistenceException),
                e -> new ForecastPersistenceException("Failed to append audit for forecast " + audit.forecastId(), e));
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    ForecastEntity toEntity(ForecastRecord record) {
        ForecastEntity entity = new ForecastEntity();
        entity.setId(record.forecastId());
        entity.setProductId(record.productId());
        entity.setStatus(record.status().name().toLowerCase());

        UnitSection product = record.productAnalysis();
        entity.setProductAnalysisSummary(product != null ? product.summary() : null);
        entity.setProductAnalysisData(product != null ? json(product.payload()) : null);
        UnitSection market = record.marketAnalysis();
        entity.setMarketAnalysisSummary(market != null ? market.summary() : null);
        entity.setMarketAnalysisData(market != null ? json(market.payload()) : null);
        UnitSection advertising = record.advertisingStrategy();
        entity.setAdvertisingStrategySummary(advertising != null ? advertising.summary() : null);
        entity.setAdvertisingStrategyData(advertising != null ? json(advertising.payload()) : null);
        UnitSection supply = record.supplyChain();
        entity.setSupplyChainSummary(supply != null ? supply.summary() : null);
        entity.setSupplyChainData(supply != null ? json(supply.payload()) : null);
        UnitSection sales = record.salesStrategy();
        entity.setSalesStrategySummary(sales != null ? sales.summary() : null);
        entity.setSalesStrategyData(sales != null ? json(sales.payload()) : null);

        ScoreSet scores = record.scores();
        if (scores != null) {
            entity.setDemandScore(scores.demandScore());
            entity.setCompetitionIndex(scores.competitionIndex());
            entity.setProfitabilityScore(scores.profitabilityScore());
            entity.setMarketFitScore(scores.marketFitScore());
            entity.setRiskScore(scores.riskScore());
            entity.setOverallScore(scores.overallScore());
            entity.setExpectedMonthlySalesVolume(scores.expectedMonthlySalesVolume());
            entity.setExpectedAnnualRevenue(scores.expectedAnnualRevenue());
            entity.setExpectedProfitMargin(scores.expectedProfitMargin());
            entity.setRecommendedPrice(scores.recommendedPrice());
            entity.setRecommendedPriceMin(scores.recommendedPriceMin());
            entity.setRecommendedPriceMax(scores.recommendedPriceMax());
            entity.setPriceElasticity(scores.priceElasticity().name().toLowerCase());
            entity.setCityRankings(json(scores.cityRankings()));
        }

        entity.setTokensUsed(record.tokensUsed());
        entity.setCostUsd(record.costUsd());
        entity.setProcessingStartedAt(record.processingStartedAt());
        entity.setProcessingCompletedAt(record.processingCompletedAt());
        entity.setProcessingDurationSeconds(record.processingDurationSeconds());
        entity.setErrorMessage(record.errorMessage());
        entity.setModelVersion(record.modelVersion());
        return entity;
    }

    AgentLogEntity toEntity(UnitExecutionAudit audit) {
        AgentLogEntity entity = new AgentLogEntity();
        entity.setForecastId(audit.forecastId());
        entity.setAgentName(audit.unit().auditKey());
        entity.setStatus(audit.status());
        entity.setSuccessful(audit.succeeded());
        entity.setErrorMessage(audit.error());
        entity.setStartedAt(audit.startedAt());
        entity.setCompletedAt(audit.completedAt());
        entity.setExecutionTimeMs(audit.durationMs());
        entity.setOutputData(audit.output());
        entity.setSummary(audit.summary());
        entity.setModelName(audit.modelName());
        entity.setTokensUsed(audit.tokensUsed());
        entity.setPromptTokens(audit.promptTokens());
        entity.setCompletionTokens(audit.completionTokens());
        entity.setCostUsd(audit.costUsd());
        entity.setReasoningSteps(json(audit.reasoningTrace()));
        entity.setConfidenceScore(audit.confidence());
        entity.setRetryCount(audit.retryCount());
        return entity;
    }

    Product toProduct(ProductEntity entity) {
        Map<String, Object> specifications = Map.of();
        if (entity.getSpecifications() != null && !entity.getSpecifications().isBlank()) {
            try {
                specifications = objectMapper.readValue(entity.getSpecifications(), MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new ForecastPersistenceException(
                    "Unreadable specifications for product " + entity.getId(), e);
            }
        }
        return new Product(entity.getId(), entity.getName(), entity.getDescription(), entity.getCategory(),
            entity.getBasePrice() != null ? entity.getBasePrice() : 0.0,
            entity.getCurrency(), entity.getProductionMethod(), entity.getQualityTier(), specifications);
    }

    static City toCity(CityEntity entity) {
        return new City(entity.getId(), entity.getName(), entity.getCountry(),
            entity.getPopulation() != null ? entity.getPopulation() : 0L,
            entity.getGdpPerCapita(),
            entity.getPurchasingPowerIndex() != null ? entity.getPurchasingPowerIndex() : 100.0,
            entity.getEcommercePenetration() != null ? entity.getEcommercePenetration() : 50.0,
            entity.getCompetitionDensity() != null ? entity.getCompetitionDensity() : 50.0,
            entity.getAverageOrderValue(),
            entity.getInternetPenetration());
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ForecastPersistenceException("Failed to serialise column value", e);
        }
    }
}
