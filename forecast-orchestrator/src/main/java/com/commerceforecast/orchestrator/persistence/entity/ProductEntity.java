package com.commerceforecast.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("products")
public class ProductEntity {

    @Id
    private String id;

    private String name;

    private String description;

    private String category;

    private Double basePrice;

    private String currency;

    private String productionMethod;

    private String qualityTier;

    /** JSON-serialised {@code Map<String, Object>} */
    private String specifications;
}
