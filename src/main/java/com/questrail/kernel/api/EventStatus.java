package com.questrail.kernel.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome carried by an event.
 */
public enum EventStatus {
    OK,
    DEFERRED,
    FAILED,
    DROPPED,
    TIMEOUT,
    UNKNOWN;

    /**
     * A terminal status closes the span the event belongs to.
     */
    public boolean isTerminal() {
        return this == OK || this == FAILED || this == DROPPED || this == TIMEOUT;
    }

    public boolean isFailure() {
        return this == FAILED || this == DROPPED || this == TIMEOUT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EventStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EventStatus s : values()) {
            if (s.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
