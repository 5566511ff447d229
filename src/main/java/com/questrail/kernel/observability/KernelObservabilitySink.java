package com.questrail.kernel.observability;

/**
 * Receives operator-facing signals from the kernel's moving parts.
 *
 * <p>This is a side channel next to the ledger. Everything reported here is also
 * recorded as an event where the behaviour requires one; the sink exists so that
 * logs and metrics do not have to be scraped out of the store.</p>
 */
public interface KernelObservabilitySink {
    /**
     * A contract evaluation deferred, blocked, overrode or dropped a request.
     */
    void onContractDecision(ContractDecisionEvent event);

    /**
     * A worker's compaction detector changed phase.
     */
    void onCompactionTransition(CompactionTransitionEvent event);

    /**
     * Bridge link lifecycle, sequence gaps and drops.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Store lifecycle: degraded mode, pruning, busy timeouts.
     */
    void onStoreEvent(StoreObservabilityEvent event);

    void onError(KernelErrorEvent event);
}
