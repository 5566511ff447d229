package com.questrail.kernel.store;

import java.util.Objects;

/**
 * Per-event outcome of an append.
 *
 * @param reason {@code null} when the event was inserted
 */
public record AppendResult(String eventId, AppendStatus status, String reason) {
    public AppendResult {
        Objects.requireNonNull(status, "status");
    }

    public boolean ok() {
        return status == AppendStatus.INSERTED;
    }

    static AppendResult inserted(String eventId) {
        return new AppendResult(eventId, AppendStatus.INSERTED, null);
    }

    static AppendResult duplicate(String eventId) {
        return new AppendResult(eventId, AppendStatus.DUPLICATE, "duplicate eventId");
    }

    static AppendResult invalid(String eventId, String reason) {
        return new AppendResult(eventId, AppendStatus.INVALID, reason);
    }

    static AppendResult busy(String eventId, String reason) {
        return new AppendResult(eventId, AppendStatus.BUSY, reason);
    }

    static AppendResult failed(String eventId, String reason) {
        return new AppendResult(eventId, AppendStatus.FAILED, reason);
    }
}
