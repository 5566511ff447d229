package com.questrail.kernel.contract;

import java.util.Locale;

/**
 * Kind of operation a request asks the pane to perform.
 */
public enum RequestKind {
    INJECT,
    RESIZE,
    KILL,
    RESTART,
    INTERRUPT;

    /**
     * High-priority intents bypass the gates, with an explicit override event.
     */
    public boolean isHighPriority() {
        return this == KILL || this == RESTART || this == INTERRUPT;
    }

    /**
     * Ownership is exclusive per worker and operation class.
     */
    public String operationClass() {
        return switch (this) {
            case INJECT -> "inject";
            case RESIZE -> "resize";
            case KILL, RESTART, INTERRUPT -> "control";
        };
    }

    /**
     * Whether an applied request holds its operation class until it is verified
     * or fails.
     */
    public boolean holdsOwnership() {
        return this == INJECT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
