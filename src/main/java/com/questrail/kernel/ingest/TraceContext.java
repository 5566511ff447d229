package com.questrail.kernel.ingest;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventIds;

import java.util.Objects;

/**
 * Causal position a producer writes its next event at.
 *
 * <p>{@link #origin(String)} is the only place a trace id is minted. Every other
 * hop derives its context from the event that caused it, so the trace id
 * travels unchanged.</p>
 */
public record TraceContext(String traceId, String parentEventId, String workerId) {
    public TraceContext {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(workerId, "workerId");
    }

    /**
     * First contact with an external request.
     */
    public static TraceContext origin(String workerId) {
        return new TraceContext(EventIds.newTraceId(), null, workerId);
    }

    public static TraceContext of(String traceId, String parentEventId, String workerId) {
        return new TraceContext(traceId, parentEventId, workerId);
    }

    /**
     * Context for an event caused by {@code cause}.
     */
    public static TraceContext after(Event cause) {
        return new TraceContext(cause.traceId(), cause.eventId(), cause.workerId());
    }

    public TraceContext withWorker(String workerId) {
        return new TraceContext(traceId, parentEventId, workerId);
    }
}
