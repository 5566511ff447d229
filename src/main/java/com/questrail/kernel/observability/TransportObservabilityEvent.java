package com.questrail.kernel.observability;

import java.time.Instant;

/**
 * @param kind short machine-stable code, e.g. {@code link_down} or {@code sequence_gap}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    String kind,
    String detail
) {
}
