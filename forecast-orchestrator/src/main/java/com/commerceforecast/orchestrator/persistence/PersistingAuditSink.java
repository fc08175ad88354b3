package com.commerceforecast.orchestrator.persistence;

import com.commerceforecast.analysis.audit.AuditSink;
import com.commerceforecast.common.model.UnitExecutionAudit;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Appends every unit execution to the {@code agent_logs} table.
 */
@Component
public class PersistingAuditSink implements AuditSink {

    private final ForecastStore store;

    public PersistingAuditSink(ForecastStore store) {
        this.store = store;
    }

    @Override
    public Mono<Void> record(UnitExecutionAudit audit) {
        return store.appendAudit(audit);
    }
}
