package com.questrail.kernel.observability;

import java.time.Instant;

public record CompactionTransitionEvent(
    Instant timestamp,
    String workerId,
    String fromPhase,
    String toPhase,
    double confidence,
    String reason
) {
}
