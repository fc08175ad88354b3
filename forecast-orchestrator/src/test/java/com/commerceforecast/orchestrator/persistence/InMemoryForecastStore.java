package com.commerceforecast.orchestrator.persistence;

import com.commerceforecast.common.exception.ForecastPersistenceException;
import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ForecastRecord;
import com.commerceforecast.common.model.Product;
import com.commerceforecast.common.model.UnitExecutionAudit;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link ForecastStore} for tests. Every saved state is kept in
 * {@link #history} so lifecycle transitions can be asserted.
 */
public class InMemoryForecastStore implements ForecastStore {

    public final Map<String, Product> products = new ConcurrentHashMap<>();
    public final Map<String, City> cities = new ConcurrentHashMap<>();
    public final Map<String, ForecastRecord> forecasts = new ConcurrentHashMap<>();
    public final List<ForecastRecord> history = new CopyOnWriteArrayList<>();
    public final List<UnitExecutionAudit> audits = new CopyOnWriteArrayList<>();

    private final AtomicInteger sequence = new AtomicInteger();
    private volatile boolean failSaves;

    public InMemoryForecastStore withProduct(Product product) {
        products.put(product.id(), product);
        return this;
    }

    public InMemoryForecastStore withCity(City city) {
        cities.put(city.id(), city);
        return this;
    }

    public void failSaves() {
        this.failSaves = true;
    }

    @Override
    public Mono<Product> loadProduct(String productId) {
        return Mono.justOrEmpty(products.get(productId));
    }

    @Override
    public Mono<List<City>> loadCities(List<String> cityIds) {
        List<City> found = new ArrayList<>();
        cityIds.stream().map(cities::get).filter(Objects::nonNull).forEach(found::add);
        return Mono.just(found);
    }

    @Override
    public Mono<ForecastRecord> createPending(String productId) {
        ForecastRecord pending = ForecastRecord.pending("forecast-" + sequence.incrementAndGet(), productId);
        return save(pending);
    }

    @Override
    public Mono<ForecastRecord> save(ForecastRecord record) {
        return Mono.defer(() -> {
            if (failSaves) {
                return Mono.error(new ForecastPersistenceException("Failed to save forecast " + record.forecastId()));
            }
            forecasts.put(record.forecastId(), record);
            history.add(record);
            return Mono.just(record);
        });
    }

    @Override
    public Mono<Void> appendAudit(UnitExecutionAudit audit) {
        return Mono.fromRunnable(() -> audits.add(audit));
    }
}
