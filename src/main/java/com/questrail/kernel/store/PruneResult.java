package com.questrail.kernel.store;

/**
 * Rows removed by one prune pass.
 */
public record PruneResult(long eventsExpired, long eventsOverCap, long edgesRemoved, long spansRemoved) {

    public static final PruneResult NONE = new PruneResult(0, 0, 0, 0);

    public long eventsRemoved() {
        return eventsExpired + eventsOverCap;
    }
}
