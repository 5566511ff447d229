package com.questrail.kernel.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.EventJson;

import java.util.Objects;
import java.util.UUID;

/**
 * A request to act on a worker's pane.
 *
 * <p>The payload is opaque to the kernel and is recorded as given. When
 * {@code traceId} is {@code null} the request is an origin point and the engine
 * mints a trace for it.</p>
 */
public record InjectionRequest(
        String requestId,
        String workerId,
        RequestKind kind,
        String traceId,
        String parentEventId,
        ObjectNode payload
) {
    public InjectionRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? EventJson.objectNode() : payload.deepCopy();
    }

    public static InjectionRequest inject(String workerId, ObjectNode payload) {
        return new InjectionRequest(newRequestId(), workerId, RequestKind.INJECT, null, null, payload);
    }

    public static InjectionRequest resize(String workerId, int cols, int rows) {
        ObjectNode dims = EventJson.objectNode();
        dims.put("cols", cols);
        dims.put("rows", rows);
        return new InjectionRequest(newRequestId(), workerId, RequestKind.RESIZE, null, null, dims);
    }

    public static InjectionRequest control(RequestKind kind, String workerId) {
        if (!kind.isHighPriority()) {
            throw new IllegalArgumentException("Not a control intent: " + kind);
        }
        return new InjectionRequest(newRequestId(), workerId, kind, null, null, null);
    }

    /**
     * Same request, continuing an existing trace below {@code parentEventId}.
     */
    public InjectionRequest inTrace(String traceId, String parentEventId) {
        return new InjectionRequest(requestId, workerId, kind, traceId, parentEventId, payload);
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    private static String newRequestId() {
        return "req_" + UUID.randomUUID();
    }
}
