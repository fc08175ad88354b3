package com.commerceforecast.orchestrator.persistence;

import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.UnitExecutionAudit;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistence collaborator of the coordinator. Failures surface as
 * {@link com.commerceforecast.common.exception.ForecastPersistenceException}.
 */
public interface ForecastStore {

    /** Empty when no product has {@code productId}. */
    Mono<Product> loadProduct(String productId);

    /** Cities in the order of {@code cityIds}; unknown ids are skipped. */
    Mono<List<City>> loadCities(List<String> cityIds);

    /** Registers a new forecast in {@code PENDING} and returns it with its generated id. */
    Mono<ForecastRecord> createPending(String productId);

    /** Updates an existing forecast with the state of {@code record}. */
    Mono<ForecastRecord> save(ForecastRecord record);

    Mono<Void> appendAudit(UnitExecutionAudit audit);
}
