package com.questrail.kernel.observability;

import java.time.Instant;
import java.util.List;

public record ContractDecisionEvent(
    Instant timestamp,
    String workerId,
    String requestId,
    String decision,
    List<String> reasons
) {
    public ContractDecisionEvent {
        reasons = List.copyOf(reasons);
    }
}
