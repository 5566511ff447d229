package com.questrail.kernel.observability;

/**
 * No-op implementation of KernelObservabilitySink.
 */
public final class NullObservabilitySink implements KernelObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onContractDecision(ContractDecisionEvent event) {}

    @Override
    public void onCompactionTransition(CompactionTransitionEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onStoreEvent(StoreObservabilityEvent event) {}

    @Override
    public void onError(KernelErrorEvent event) {}
}
