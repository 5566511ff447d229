package com.questrail.kernel.compaction;

import java.util.Objects;

/**
 * Result of one detector step.
 *
 * @param reason why the phase changed, or {@code null} when it did not
 */
public record Transition(DetectorState state, CompactionPhase from, CompactionPhase to, String reason) {

    public Transition {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public boolean changed() {
        return from != to;
    }
}
