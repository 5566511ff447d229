package com.questrail.kernel.api;

import java.util.Locale;
import java.util.Optional;

public enum EdgeType {
    PARENT,
    ACK_OF,
    RETRY_OF;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EdgeType> fromWire(String value) {
        for (EdgeType t : values()) {
            if (t.wireName().equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
