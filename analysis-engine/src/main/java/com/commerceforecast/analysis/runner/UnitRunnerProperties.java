package com.commerceforecast.analysis.runner;

import com.commerceforecast.common.model.UnitName;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Execution limits for unit runs ({@code forecast.units.*}).
 */
@Data
@ConfigurationProperties(prefix = "forecast.units")
public class UnitRunnerProperties {

    /** Applies to every unit without an entry in {@link #timeouts}. */
    private Duration timeout = Duration.ofSeconds(90);

    private Map<UnitName, Duration> timeouts = new HashMap<>();

    /** Extra attempts after a backend failure. Parse and validation errors are never retried. */
    private int maxRetries = 0;

    private int outputTruncation = 2000;

    public Duration timeoutFor(UnitName unit) {
        return timeouts.getOrDefault(unit, timeout);
    }
}
