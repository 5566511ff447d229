package com.questrail.kernel.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of hops an event can belong to.
 *
 * <p>The declaration order is the order of a message's journey through the
 * system; {@link #SYSTEM} sits outside that journey.</p>
 */
public enum Stage {
    INGRESS,
    ROUTE,
    INJECT,
    TRANSPORT,
    TERMINAL,
    ACK,
    VERIFY,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Stage> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Stage s : values()) {
            if (s.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
