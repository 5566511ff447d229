package com.questrail.kernel.compaction;

import java.util.Objects;
import java.util.Set;

/**
 * Evidence fed to {@link CompactionDetector#advance}.
 *
 * @param observed    {@code false} for a timer tick with no new output; the
 *                    detector then re-applies its last confidence, downward only
 * @param kinds       distinct signal kinds present in the chunk
 * @param score       weighted confidence in [0, 1]
 * @param promptReady the chunk ends at a prompt
 */
public record CompactionSignal(boolean observed, Set<SignalKind> kinds, double score, boolean promptReady) {

    private static final CompactionSignal TICK = new CompactionSignal(false, Set.of(), 0.0, false);

    public CompactionSignal {
        Objects.requireNonNull(kinds, "kinds");
        kinds = Set.copyOf(kinds);
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1]");
        }
    }

    public static CompactionSignal tick() {
        return TICK;
    }

    public static CompactionSignal of(Set<SignalKind> kinds, double score, boolean promptReady) {
        return new CompactionSignal(true, kinds, score, promptReady);
    }
}
