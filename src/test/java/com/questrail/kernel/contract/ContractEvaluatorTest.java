package com.questrail.kernel.contract;

import com.questrail.kernel.compaction.CompactionPhase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Pure evaluation: no events, no timers.
 */
class ContractEvaluatorTest {

    private final ContractEvaluator evaluator = ContractEvaluator.defaults();

    private static WorkerContext context(PaneStateVector state) {
        return new WorkerContext("w1", state);
    }

    @Test
    void idlePaneAllowsInjection() {
        Evaluation e = evaluator.evaluate(context(PaneStateVector.initial()), InjectionRequest.inject("w1", null));
        assertEquals(Decision.ALLOW, e.decision());
    }

    @Test
    void everyClosedGateIsReportedInContractOrder() {
        PaneStateVector s = PaneStateVector.initial()
                .withFocusLocked(true)
                .withCompacting(CompactionPhase.CONFIRMED)
                .withSafeMode(true);

        Evaluation e = evaluator.evaluate(context(s), InjectionRequest.inject("w1", null));

        assertEquals(Decision.DEFER, e.decision());
        assertEquals(List.of("focus_lock", "compaction_gate", "safe_mode"), e.reasonCodes());
        assertEquals(List.of(FocusLockGuard.ID, CompactionGate.ID, SafeModeGuard.ID), e.contractIds());
    }

    @Test
    void suspectedCompactionDoesNotGate() {
        PaneStateVector s = PaneStateVector.initial().withCompacting(CompactionPhase.SUSPECTED);
        assertEquals(Decision.ALLOW,
                evaluator.evaluate(context(s), InjectionRequest.inject("w1", null)).decision());

        PaneStateVector cooldown = PaneStateVector.initial().withCompacting(CompactionPhase.COOLDOWN);
        assertEquals(Decision.ALLOW,
                evaluator.evaluate(context(cooldown), InjectionRequest.inject("w1", null)).decision());
    }

    @Test
    void highPriorityIntentOverridesClosedGates() {
        PaneStateVector s = PaneStateVector.initial().withFocusLocked(true);

        Evaluation e = evaluator.evaluate(context(s), InjectionRequest.control(RequestKind.INTERRUPT, "w1"));

        assertEquals(Decision.OVERRIDE, e.decision());
        assertEquals(List.of("focus_lock"), e.reasonCodes());
    }

    @Test
    void heldOperationClassBlocksASecondInjection() {
        WorkerContext ctx = context(PaneStateVector.initial());
        InjectionRequest first = InjectionRequest.inject("w1", null);
        ctx.inFlight().put("inject", new WorkerContext.InFlight(first, "t1", "e1"));

        Evaluation e = evaluator.evaluate(ctx, InjectionRequest.inject("w1", null));

        assertEquals(Decision.BLOCK, e.decision());
        assertEquals(first.requestId(), e.holder());
        assertEquals(List.of("ownership_conflict"), e.reasonCodes());
    }

    @Test
    void heldOperationClassBlocksEvenBehindClosedGates() {
        WorkerContext ctx = context(PaneStateVector.initial().withFocusLocked(true));
        InjectionRequest first = InjectionRequest.inject("w1", null);
        ctx.inFlight().put("inject", new WorkerContext.InFlight(first, "t1", "e1"));

        Evaluation e = evaluator.evaluate(ctx, InjectionRequest.inject("w1", null));

        assertEquals(Decision.BLOCK, e.decision());
        assertEquals(List.of("ownership_conflict"), e.reasonCodes());
        assertEquals(first.requestId(), e.holder());
    }

    @Test
    void resizeCoalescesOnlyWhileInjecting() {
        InjectionRequest resize = InjectionRequest.resize("w1", 120, 40);

        assertEquals(Decision.ALLOW,
                evaluator.evaluate(context(PaneStateVector.initial().withFocusLocked(true)), resize).decision());
        assertEquals(Decision.COALESCE,
                evaluator.evaluate(context(PaneStateVector.initial().withActivity(Activity.INJECTING)), resize).decision());
    }
}
