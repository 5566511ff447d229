package com.questrail.kernel.compaction;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable state of one worker's compaction detector.
 *
 * <p>Timestamps are monotonic milliseconds; {@link #UNSET} marks a timer that is
 * not running.</p>
 *
 * @param aboveSince   when confidence first held above the next upward threshold
 * @param belowSince   when confidence first held below the decay threshold
 * @param suspectHits  rising edges through the suspect threshold, newest last
 * @param aboveSuspect the last observed confidence was at or above suspect
 */
public record DetectorState(
        CompactionPhase phase,
        double confidence,
        Set<SignalKind> signals,
        long aboveSince,
        long belowSince,
        long confirmedAt,
        long cooldownAt,
        List<Long> suspectHits,
        boolean aboveSuspect
) {
    public static final long UNSET = -1L;

    public DetectorState {
        Objects.requireNonNull(phase, "phase");
        signals = Set.copyOf(signals);
        suspectHits = List.copyOf(suspectHits);
    }

    public static DetectorState initial() {
        return new DetectorState(CompactionPhase.NONE, 0.0, Set.of(), UNSET, UNSET, UNSET, UNSET, List.of(), false);
    }
}
