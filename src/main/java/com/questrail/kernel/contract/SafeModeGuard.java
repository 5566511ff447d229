package com.questrail.kernel.contract;

import java.util.Optional;

/**
 * Holds all normal-priority work while the engine is in safe mode after a burst
 * of violations.
 */
public final class SafeModeGuard implements PaneContract {
    public static final String ID = "safe-mode-guard";

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
        return context.state().safeMode() ? Optional.of(BlockReason.SAFE_MODE) : Optional.empty();
    }
}
