package com.questrail.kernel.compaction;

import java.util.Locale;

/**
 * Phase of a worker's compaction detector, as seen by the contract engine's
 * {@code compacting} gate.
 */
public enum CompactionPhase {
    NONE,
    SUSPECTED,
    CONFIRMED,
    COOLDOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
