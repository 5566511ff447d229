package com.questrail.kernel.api;

/**
 * Capacity class of an event type.
 *
 * <p>Only {@link #TELEMETRY} may be discarded when a bounded queue is full.
 * Everything else is admitted and only ever dropped by explicit policy, which
 * itself produces an event.</p>
 */
public enum EventClass {
    TELEMETRY,
    LIFECYCLE,
    CONTRACT,
    SYSTEM;

    public boolean isDroppable() {
        return this == TELEMETRY;
    }
}
