package com.questrail.kernel.contract;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ContractEvaluator
 * =============================================================================
 * Pure evaluation of a request against a worker's context.
 *
 * <h2>Order</h2>
 * <ol>
 *   <li>A resize while the pane is injecting coalesces.</li>
 *   <li>Ownership is checked. A conflicting holder blocks the request whatever
 *       the gates say.</li>
 *   <li>Every gate is checked and every blocking reason collected. A
 *       high-priority intent overrides them; anything else is deferred.</li>
 * </ol>
 * No contract ever drops a request.
 */
public final class ContractEvaluator {

    private final List<PaneContract> gates;
    private final PaneContract ownership;

    public ContractEvaluator(List<PaneContract> gates, PaneContract ownership) {
        this.gates = List.copyOf(gates);
        this.ownership = Objects.requireNonNull(ownership, "ownership");
    }

    public static ContractEvaluator defaults() {
        return new ContractEvaluator(
                List.of(new FocusLockGuard(), new CompactionGate(), new SafeModeGuard()),
                new OwnershipExclusive());
    }

    public Evaluation evaluate(WorkerContext context, InjectionRequest request) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(request, "request");

        if (request.kind() == RequestKind.RESIZE) {
            return context.state().activity() == Activity.INJECTING ? Evaluation.coalesce() : Evaluation.allow();
        }

        if (ownership.appliesTo(request.kind())) {
            if (ownership.check(context, request).isPresent()) {
                String holder = context.holderOf(request.kind().operationClass()).orElse(null);
                return new Evaluation(Decision.BLOCK, List.of(BlockReason.OWNERSHIP), holder);
            }
        }

        List<BlockReason> reasons = new ArrayList<>();
        for (PaneContract gate : gates) {
            if (gate.appliesTo(request.kind())) {
                gate.check(context, request).ifPresent(reasons::add);
            }
        }
        if (!reasons.isEmpty()) {
            Decision d = request.kind().isHighPriority() ? Decision.OVERRIDE : Decision.DEFER;
            return new Evaluation(d, reasons, null);
        }
        return Evaluation.allow();
    }
}
