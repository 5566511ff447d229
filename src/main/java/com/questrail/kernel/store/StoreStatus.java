package com.questrail.kernel.store;

/**
 * Point-in-time health of an {@link EventStore}.
 *
 * @param degradedReason why the store is not durable, or {@code null}
 */
public record StoreStatus(
        boolean durable,
        String backend,
        String degradedReason,
        long eventCount,
        long duplicateCount,
        long invalidCount,
        long busyCount
) {
}
