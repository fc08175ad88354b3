package com.commerceforecast.analysis.audit;

import com.commerceforecast.common.model.UnitExecutionAudit;
import reactor.core.publisher.Mono;

/**
 * Receives one entry per unit invocation. A failing sink never fails the run;
 * the runner logs the error and moves on.
 */
public interface AuditSink {

    Mono<Void> record(UnitExecutionAudit audit);
}
