package com.questrail.kernel.api;

import java.util.Objects;

/**
 * Directed causal relation inside one trace, from the cause to the event that
 * declared it. Identity is the full tuple; edges are never updated.
 */
public record Edge(String traceId, String fromEventId, String toEventId, EdgeType type) {
    public Edge {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(fromEventId, "fromEventId");
        Objects.requireNonNull(toEventId, "toEventId");
        Objects.requireNonNull(type, "type");
    }
}
