package com.questrail.kernel.contract;

import com.questrail.kernel.compaction.CompactionPhase;

import java.util.Optional;

/**
 * The driven program is compacting its context. Only a confirmed compaction
 * closes the gate; a suspicion or a cooldown does not.
 */
public final class CompactionGate implements PaneContract {
    public static final String ID = "compaction-gate";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesTo(RequestKind kind) {
        return kind != RequestKind.RESIZE;
    }

    @Override
    public Optional<BlockReason> check(WorkerContext context, InjectionRequest request) {
        return context.state().compacting() == CompactionPhase.CONFIRMED
                ? Optional.of(BlockReason.COMPACTION)
                : Optional.empty();
    }
}
