package com.commerceforecast.orchestrator.persistence.repository;

import com.commerceforecast.orchestrator.persistence.entity.AgentLogEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AgentLogRepository extends ReactiveCrudRepository<AgentLogEntity, Long> {
}
