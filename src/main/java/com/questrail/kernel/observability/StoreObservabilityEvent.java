package com.questrail.kernel.observability;

import java.time.Instant;

public record StoreObservabilityEvent(
    Instant timestamp,
    String kind,
    String detail
) {
}
