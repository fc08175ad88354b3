package com.commerceforecast.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("cities")
public class CityEntity {

    @Id
    private String id;

    private String name;

    private String country;

    private Long population;

    private Double gdpPerCapita;

    private Double purchasingPowerIndex;

    private Double ecommercePenetration;

    private Double competitionDensity;

    private Double averageOrderValue;

    private Double internetPenetration;
}
