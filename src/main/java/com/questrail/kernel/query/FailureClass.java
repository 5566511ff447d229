package com.questrail.kernel.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Machine-stable cause assigned to a failure path. Wire names match the reason
 * codes the contract engine writes into {@code inject.deferred},
 * {@code inject.dropped} and {@code contract.violation} payloads.
 */
public enum FailureClass {
    OWNERSHIP_CONFLICT,
    FOCUS_LOCK,
    COMPACTION_GATE,
    SAFE_MODE,
    ACK_GAP,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FailureClass> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (FailureClass c : values()) {
            if (c.wireName().equals(v)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
