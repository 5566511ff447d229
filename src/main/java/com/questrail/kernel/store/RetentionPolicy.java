package com.questrail.kernel.store;

import java.time.Duration;
import java.util.Objects;

/**
 * RetentionPolicy
 * -----------------------------------------------------------------------------
 * Bounds on how long and how much the ledger keeps.
 *
 * <ul>
 *   <li><b>ttl</b>: events older than this (by producer timestamp) are pruned</li>
 *   <li><b>maxRows</b>: hard cap; the oldest arrivals go first</li>
 *   <li><b>pruneInterval</b>: how often the runtime runs a prune pass</li>
 * </ul>
 */
public record RetentionPolicy(Duration ttl, long maxRows, Duration pruneInterval) {
    public RetentionPolicy {
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(pruneInterval, "pruneInterval");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        if (pruneInterval.isNegative() || pruneInterval.isZero()) {
            throw new IllegalArgumentException("pruneInterval must be positive");
        }
    }

    /**
     * 7 days, 2,000,000 rows, pruned every 10 minutes.
     */
    public static RetentionPolicy defaults() {
        return new RetentionPolicy(Duration.ofDays(7), 2_000_000L, Duration.ofMinutes(10));
    }
}
