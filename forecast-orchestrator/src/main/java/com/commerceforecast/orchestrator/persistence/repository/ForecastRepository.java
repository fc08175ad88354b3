package com.commerceforecast.orchestrator.persistence.repository;

import com.commerceforecast.orchestrator.persistence.entity.ForecastEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ForecastRepository extends ReactiveCrudRepository<ForecastEntity, String> {
}
