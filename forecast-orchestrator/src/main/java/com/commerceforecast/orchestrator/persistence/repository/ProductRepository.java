package com.commerceforecast.orchestrator.persistence.repository;

import com.commerceforecast.orchestrator.persistence.entity.ProductEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProductRepository extends ReactiveCrudRepository<ProductEntity, String> {
}
