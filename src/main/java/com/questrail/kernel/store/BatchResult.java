package com.questrail.kernel.store;

import java.util.List;

/**
 * Results of a best-effort batch append, one per input event and in input order.
 */
public record BatchResult(List<AppendResult> results) {
    public BatchResult {
        results = List.copyOf(results);
    }

    public long insertedCount() {
        return results.stream().filter(AppendResult::ok).count();
    }

    public long rejectedCount() {
        return results.size() - insertedCount();
    }
}
