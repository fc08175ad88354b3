package com.commerceforecast.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Row of {@code forecasts}. Ids are assigned by the application, so {@link #isNew()}
 * decides between insert and update.
 *
 * <p>{@code *Data} columns hold the JSON-serialised unit payload; {@code cityRankings}
 * the JSON-serialised top-ten rankings.
 */
@Data
@NoArgsConstructor
@Table("forecasts")
public class ForecastEntity implements Persistable<String> {

    @Id
    private String id;

    private String productId;

    private String status;

    private String productAnalysisSummary;
    private String productAnalysisData;

    private String marketAnalysisSummary;
    private String marketAnalysisData;

    private String advertisingStrategySummary;
    private String advertisingStrategyData;

    private String supplyChainSummary;
    private String supplyChainData;

    private String salesStrategySummary;
    private String salesStrategyData;

    // ── scores (null until completed) ──

    private Double demandScore;
    private Double competitionIndex;
    private Double profitabilityScore;
    private Double marketFitScore;
    private Double riskScore;
    private Double overallScore;
    private Long expectedMonthlySalesVolume;
    private Double expectedAnnualRevenue;
    private Double expectedProfitMargin;
    private Double recommendedPrice;
    private Double recommendedPriceMin;
    private Double recommendedPriceMax;
    private String priceElasticity;
    private String cityRankings;

    private Integer tokensUsed;
    private Double costUsd;

    private Instant processingStartedAt;
    private Instant processingCompletedAt;
    private Double processingDurationSeconds;

    private String errorMessage;
    private String modelVersion;

    @Transient
    private boolean newEntity;

    @Override
    public boolean isNew() {
        return newEntity;
    }
}
