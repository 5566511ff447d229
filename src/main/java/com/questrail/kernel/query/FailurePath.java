package com.questrail.kernel.query;

import com.questrail.kernel.api.Event;

import java.util.List;
import java.util.Objects;

/**
 * The causally earliest failing event of a trace, what followed from it and the
 * classified cause.
 *
 * @param downstream events below {@code failingEvent}, in causal order
 * @param inputs     the evidence the classification was derived from
 */
public record FailurePath(
        String traceId,
        Event failingEvent,
        List<Event> downstream,
        FailureClass failureClass,
        double confidence,
        List<String> inputs
) {
    public FailurePath {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(failingEvent, "failingEvent");
        Objects.requireNonNull(failureClass, "failureClass");
        downstream = List.copyOf(downstream);
        inputs = List.copyOf(inputs);
    }
}
