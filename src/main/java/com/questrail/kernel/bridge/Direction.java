package com.questrail.kernel.bridge;

import java.util.Optional;

/**
 * Which way an envelope crossed the bridge.
 */
public enum Direction {
    PRODUCER_TO_KERNEL("producer->kernel"),
    KERNEL_TO_PRODUCER("kernel->producer");

    private final String wireName;

    Direction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Direction> fromWire(String value) {
        for (Direction d : values()) {
            if (d.wireName.equals(value)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
