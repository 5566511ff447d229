package com.questrail.kernel.contract;

import java.util.Optional;

/**
 * A human holds focus on the pane; injected input would interleave with typing.
 */
public final class FocusLockGuard implements PaneContract {
    public static final String ID = "focus-lock-guard";

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
        return context.state().focusLocked() ? Optional.of(BlockReason.FOCUS_LOCK) : Optional.empty();
    }
}
