package com.commerceforecast.orchestrator;

import com.commerceforecast.analysis.config.AnalysisEngineConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(AnalysisEngineConfig.class)
public class ForecastOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastOrchestratorApplication.class, args);
    }
}
