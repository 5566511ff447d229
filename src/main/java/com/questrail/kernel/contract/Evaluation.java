package com.questrail.kernel.contract;

import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating every contract against one request.
 *
 * @param reasons all blocking reasons found, in contract order; for
 *                {@link Decision#OVERRIDE} these are the bypassed reasons
 */
public record Evaluation(Decision decision, List<BlockReason> reasons, String holder) {

    public Evaluation {
        Objects.requireNonNull(decision, "decision");
        reasons = List.copyOf(reasons);
    }

    public static Evaluation allow() {
        return new Evaluation(Decision.ALLOW, List.of(), null);
    }

    public static Evaluation coalesce() {
        return new Evaluation(Decision.COALESCE, List.of(), null);
    }

    public List<String> reasonCodes() {
        return reasons.stream().map(BlockReason::code).toList();
    }

    public List<String> contractIds() {
        return reasons.stream().map(BlockReason::contractId).distinct().toList();
    }
}
