package com.questrail.kernel.contract;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing for the contract engine.
 *
 * @param deferTtl                  how long a deferred request may wait
 * @param safeModeViolations        violations that trigger safe mode
 * @param safeModeWindow            window the violations are counted in
 * @param safeModeDuration          how long safe mode lasts
 * @param ownerLease                how long an applied injection may hold its
 *                                  operation class without being verified
 */
public record ContractTimingPolicy(
        Duration deferTtl,
        int safeModeViolations,
        Duration safeModeWindow,
        Duration safeModeDuration,
        Duration ownerLease
) {
    public ContractTimingPolicy {
        Objects.requireNonNull(deferTtl, "deferTtl");
        Objects.requireNonNull(safeModeWindow, "safeModeWindow");
        Objects.requireNonNull(safeModeDuration, "safeModeDuration");
        Objects.requireNonNull(ownerLease, "ownerLease");
        if (deferTtl.isNegative() || deferTtl.isZero()) {
            throw new IllegalArgumentException("deferTtl must be > 0");
        }
        if (safeModeViolations < 1) {
            throw new IllegalArgumentException("safeModeViolations must be >= 1");
        }
        if (ownerLease.isNegative() || ownerLease.isZero()) {
            throw new IllegalArgumentException("ownerLease must be > 0");
        }
    }

    public static ContractTimingPolicy defaults() {
        return new ContractTimingPolicy(Duration.ofSeconds(30), 3, Duration.ofSeconds(10), Duration.ofSeconds(30),
                Duration.ofSeconds(15));
    }

    public ContractTimingPolicy withDeferTtl(Duration deferTtl) {
        return new ContractTimingPolicy(deferTtl, safeModeViolations, safeModeWindow, safeModeDuration, ownerLease);
    }

    public ContractTimingPolicy withOwnerLease(Duration ownerLease) {
        return new ContractTimingPolicy(deferTtl, safeModeViolations, safeModeWindow, safeModeDuration, ownerLease);
    }
}
