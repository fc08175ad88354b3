package com.commerceforecast.analysis.config;

import com.commerceforecast.analysis.audit.AuditSink;
import com.commerceforecast.analysis.backend.GenerationProperties;
import com.commerceforecast.analysis.runner.UnitRunner;
import com.commerceforecast.analysis.runner.UnitRunnerProperties;
import com.commerceforecast.analysis.runner.UsagePricing;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@ComponentScan(basePackages = "com.commerceforecast.analysis")
@EnableConfigurationProperties({GenerationProperties.class, UnitRunnerProperties.class})
public class AnalysisEngineConfig {

    @Bean
    public UsagePricing usagePricing(GenerationProperties generation) {
        return new UsagePricing(generation.getPromptUsdPerMillion(), generation.getCompletionUsdPerMillion());
    }

    @Bean
    public UnitRunner unitRunner(List<AuditSink> auditSinks, UnitRunnerProperties properties,
                                 UsagePricing pricing, ObjectMapper objectMapper,
                                 GenerationProperties generation) {
        return new UnitRunner(auditSinks, properties, pricing, objectMapper, generation.getModel());
    }
}
