package com.commerceforecast.analysis.audit;

import com.commerceforecast.common.model.UnitExecutionAudit;
import com.commerceforecast.common.trace.ForecastContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes every unit execution to the application log, tagged with the forecast id.
 */
@Component
public class LoggingAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

    @Override
    public Mono<Void> record(UnitExecutionAudit audit) {
        return Mono.fromRunnable(() -> ForecastContext.withMdc(audit.forecastId(), audit.unit().auditKey(), () -> {
            if (audit.succeeded()) {
                log.info("[UnitAudit] unit={} status={} durationMs={} tokens={} costUsd={} confidence={} retries={}",
                    audit.unit().auditKey(), audit.status(), audit.durationMs(), audit.tokensUsed(),
                    audit.costUsd(), audit.confidence(), audit.retryCount());
            } else {
                log.warn("[UnitAudit] unit={} status={} durationMs={} tokens={} retries={} error={}",
                    audit.unit().auditKey(), audit.status(), audit.durationMs(), audit.tokensUsed(),
                    audit.retryCount(), audit.error());
            }
        }));
    }
}
