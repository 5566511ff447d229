package com.questrail.kernel.contract;

import com.questrail.kernel.time.Cancellable;

import java.util.List;
import java.util.Objects;

/**
 * A request waiting for its gates to clear.
 *
 * <p>All deferral, resume and drop events of one request share {@code spanId};
 * the span closes when the request resumes or is dropped.</p>
 */
final class DeferredRequest {
    final InjectionRequest request;
    final String traceId;
    final String spanId;
    final long deferredAtNanos;

    int attempt;
    String lastEventId;
    List<BlockReason> lastReasons;
    Cancellable ttlTimer;

    DeferredRequest(InjectionRequest request, String traceId, String spanId, long deferredAtNanos) {
        this.request = Objects.requireNonNull(request, "request");
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.spanId = Objects.requireNonNull(spanId, "spanId");
        this.deferredAtNanos = deferredAtNanos;
    }

    List<String> lastReasonCodes() {
        return lastReasons.stream().map(BlockReason::code).toList();
    }
}
