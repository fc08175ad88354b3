package com.commerceforecast.orchestrator.persistence.repository;

import com.commerceforecast.orchestrator.persistence.entity.CityEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CityRepository extends ReactiveCrudRepository<CityEntity, String> {
}
