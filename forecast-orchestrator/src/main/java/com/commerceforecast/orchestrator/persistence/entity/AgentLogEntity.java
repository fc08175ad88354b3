package com.commerceforecast.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * One row per unit execution. {@code agentName} is the unit's audit key
 * ({@code product_analyst}, ...); {@code outputData} is already truncated.
 */
@Data
@NoArgsConstructor
@Table("agent_logs")
public class AgentLogEntity {

    @Id
    private Long id;

    private String forecastId;

    private String agentName;

    private String status;

    private Boolean successful;

    private String errorMessage;

    private Instant startedAt;

    private Instant completedAt;

    private Long executionTimeMs;

    private String outputData;

    private String summary;

    private String modelName;

    private Integer tokensUsed;

    private Integer promptTokens;

    private Integer completionTokens;

    private Double costUsd;

    /** JSON-serialised {@code List<String>} */
    private String reasoningSteps;

    private Double confidenceScore;

    private Integer retryCount;
}
