package com.questrail.kernel.api;

/**
 * Destination for events produced inside the kernel.
 *
 * <p>In a running kernel this is the ledger writer's append path. Components
 * never write to a store directly.</p>
 */
@FunctionalInterface
public interface EventSink {
    void emit(Event event);
}
