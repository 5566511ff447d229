package com.questrail.kernel.api;

import java.util.Objects;

/**
 * Span
 * -----------------------------------------------------------------------------
 * Summary of one hop within a trace, scoped to a stage/worker pair.
 *
 * <p>A span is opened by the first event carrying its {@code spanId} and closed
 * by the first event with a terminal {@link EventStatus}. Later events still
 * count towards {@link #eventCount()} but do not reopen or re-close it.</p>
 *
 * @param endedAt {@code null} while the span is open
 */
public record Span(
        String spanId,
        String traceId,
        Stage stage,
        String workerId,
        long startedAt,
        Long endedAt,
        EventStatus status,
        int eventCount
) {
    public Span {
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(status, "status");
    }

    public static Span openedBy(Event event) {
        Span span = new Span(event.spanId(), event.traceId(), event.stage(), event.workerId(),
                event.timestamp(), null, EventStatus.UNKNOWN, 0);
        return span.withEvent(event);
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    /**
     * Returns the span after accounting for {@code event}.
     */
    public Span withEvent(Event event) {
        if (isOpen() && event.status().isTerminal()) {
            long end = Math.max(startedAt, event.timestamp());
            return new Span(spanId, traceId, stage, workerId, startedAt, end, event.status(), eventCount + 1);
        }
        EventStatus next = isOpen() ? event.status() : status;
        return new Span(spanId, traceId, stage, workerId, startedAt, endedAt, next, eventCount + 1);
    }
}
