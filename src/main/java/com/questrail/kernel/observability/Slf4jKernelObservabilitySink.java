package com.questrail.kernel.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of KernelObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jKernelObservabilitySink implements KernelObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jKernelObservabilitySink.class);

    @Override
    public void onContractDecision(ContractDecisionEvent event) {
        if ("allow".equals(event.decision())) {
            log.debug("Worker {}: request {} allowed", event.workerId(), event.requestId());
            return;
        }
        log.info("Worker {}: request {} {} {}",
            event.workerId(),
            event.requestId(),
            event.decision(),
            event.reasons());
    }

    @Override
    public void onCompactionTransition(CompactionTransitionEvent event) {
        log.info("Worker {}: compaction {} -> {} (confidence {}, {})",
            event.workerId(),
            event.fromPhase(),
            event.toPhase(),
            String.format("%.2f", event.confidence()),
            event.reason());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("Bridge {}: {}", event.kind(), event.detail());
    }

    @Override
    public void onStoreEvent(StoreObservabilityEvent event) {
        if ("degraded".equals(event.kind()) || "busy".equals(event.kind())) {
            log.warn("Event store {}: {}", event.kind(), event.detail());
        } else {
            log.debug("Event store {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(KernelErrorEvent event) {
        log.error("Event kernel error: {}", event.message(), event.cause());
    }
}
