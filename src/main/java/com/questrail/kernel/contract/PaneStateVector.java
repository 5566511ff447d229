package com.questrail.kernel.contract;

import com.questrail.kernel.compaction.CompactionPhase;

import java.util.Objects;

/**
 * PaneStateVector
 * -----------------------------------------------------------------------------
 * Live state of one worker's pane, rebuilt from the committed event stream.
 *
 * <p>Lanes are independent: every combination of values is legal. The vector is
 * immutable; each {@code withX} returns a copy.</p>
 */
public record PaneStateVector(
        Activity activity,
        boolean focusLocked,
        CompactionPhase compacting,
        boolean safeMode,
        LinkState bridge,
        LinkState terminal
) {
    public PaneStateVector {
        Objects.requireNonNull(activity, "activity");
        Objects.requireNonNull(compacting, "compacting");
        Objects.requireNonNull(bridge, "bridge");
        Objects.requireNonNull(terminal, "terminal");
    }

    public static PaneStateVector initial() {
        return new PaneStateVector(Activity.IDLE, false, CompactionPhase.NONE, false, LinkState.UP, LinkState.UP);
    }

    public PaneStateVector withActivity(Activity activity) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }

    public PaneStateVector withFocusLocked(boolean focusLocked) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }

    public PaneStateVector withCompacting(CompactionPhase compacting) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }

    public PaneStateVector withSafeMode(boolean safeMode) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }

    public PaneStateVector withBridge(LinkState bridge) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }

    public PaneStateVector withTerminal(LinkState terminal) {
        return new PaneStateVector(activity, focusLocked, compacting, safeMode, bridge, terminal);
    }
}
