package com.commerceforecast.analysis.backend;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and pricing settings for the Anthropic backend ({@code forecast.generation.*}).
 */
@Data
@ConfigurationProperties(prefix = "forecast.generation")
public class GenerationProperties {

    private String baseUrl = "https://api.anthropic.com";
    private String apiKey = "";
    private String model = "claude-sonnet-4-6";
    private String anthropicVersion = "2023-06-01";

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Socket read timeout; the per-unit timeout in {@code forecast.units} is usually the tighter bound. */
    private Duration readTimeout = Duration.ofSeconds(120);

    /** USD per one million prompt tokens. */
    private double promptUsdPerMillion = 10.0;

    /** USD per one million completion tokens. */
    private double completionUsdPerMillion = 30.0;
}
