package com.questrail.kernel.bridge;

import com.questrail.kernel.api.EventStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed outcomes a command acknowledgment may report.
 */
public enum AckStatus {
    ACCEPTED,
    REJECTED_TARGET_MISSING,
    REJECTED_NOT_ALIVE,
    REJECTED_MODE_UNSUPPORTED,
    BLOCKED_DEDUP,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Status of the {@code command.ack} event carrying this outcome.
     */
    public EventStatus eventStatus() {
        return switch (this) {
            case ACCEPTED -> EventStatus.OK;
            case BLOCKED_DEDUP -> EventStatus.DROPPED;
            default -> EventStatus.FAILED;
        };
    }

    public static Optional<AckStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AckStatus s : values()) {
            if (s.wireName().equals(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
