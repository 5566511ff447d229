package com.questrail.kernel.compaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * CompactionDetector
 * =============================================================================
 * Hysteresis state machine that decides whether a worker's program is compacting
 * its context.
 *
 * <pre>
 *   none ──(≥ suspect, sustained)──→ suspected ──(≥ confirm, sustained | rapid hits)──→ confirmed
 *     ↑                                  │                                                 │
 *     └────────(decay)───────────────────┘                 (prompt | decay | max duration) │
 *     ↑                                                                                     ↓
 *     └──────────────(quiet for cooldown)────────────── cooldown ←──────────────────────────┘
 *                                                          │
 *                                                          └──(renewed evidence)──→ confirmed
 * </pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Every upward transition needs at least {@code minSignalKinds} distinct
 *       signal kinds; one kind of evidence alone never raises the phase.</li>
 *   <li>Rapid promotion counts rising edges through the suspect threshold, so a
 *       steady stream of mid-confidence output cannot confirm by itself.</li>
 *   <li>Only an observed chunk can raise the phase or complete a sustain
 *       window. A timer tick re-applies the last observed confidence to the
 *       downward rules only, so decay, cooldown and the confirmed-duration cap
 *       advance without output.</li>
 * </ul>
 *
 * <p>{@link #advance} is a pure function of its arguments.</p>
 */
public final class CompactionDetector {

    private final CompactionThresholds t;

    public CompactionDetector(CompactionThresholds thresholds) {
        this.t = Objects.requireNonNull(thresholds, "thresholds");
    }

    public CompactionThresholds thresholds() {
        return t;
    }

    public Transition advance(DetectorState s, long nowMs, CompactionSignal signal) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(signal, "signal");

        boolean fresh = signal.observed();
        double conf = fresh ? signal.score() : s.confidence();
        Set<SignalKind> kinds = fresh ? signal.kinds() : s.signals();
        boolean multi = kinds.size() >= t.minSignalKinds();
        boolean aboveSuspect = conf >= t.suspectThreshold();
        boolean risingEdge = fresh && aboveSuspect && !s.aboveSuspect();

        Step step = new Step(s, conf, kinds, aboveSuspect);

        switch (s.phase()) {
            case NONE -> {
                if (!fresh) {
                    break;
                }
                if (aboveSuspect && multi) {
                    long since = step.startAbove(nowMs);
                    if (nowMs - since >= t.suspectSustainMs()) {
                        step.aboveSince = DetectorState.UNSET;
                        step.hits = new ArrayList<>(List.of(nowMs));
                        return step.to(CompactionPhase.SUSPECTED, "sustained_confidence");
                    }
                } else {
                    step.aboveSince = DetectorState.UNSET;
                }
            }
            case SUSPECTED -> {
                step.hits = recentHits(s.suspectHits(), nowMs);
                if (risingEdge) {
                    step.hits.add(nowMs);
                }
                boolean rapid = step.hits.size() >= t.rapidCount();

                if (!aboveSuspect) {
                    step.aboveSince = DetectorState.UNSET;
                    long since = step.startBelow(nowMs);
                    if (nowMs - since >= t.decayMs()) {
                        step.belowSince = DetectorState.UNSET;
                        step.hits = new ArrayList<>();
                        return step.to(CompactionPhase.NONE, "confidence_decay");
                    }
                } else if (!fresh) {
                    // Silence holds the phase; the confirm window needs new output.
                } else if (conf >= t.confirmThreshold() && multi) {
                    step.belowSince = DetectorState.UNSET;
                    long since = step.startAbove(nowMs);
                    if (nowMs - since >= t.confirmSustainMs() || rapid) {
                        return confirm(step, nowMs, rapid ? "rapid_suspect_hits" : "sustained_confidence");
                    }
                } else if (rapid && multi) {
                    return confirm(step, nowMs, "rapid_suspect_hits");
                } else {
                    step.aboveSince = DetectorState.UNSET;
                    step.belowSince = DetectorState.UNSET;
                }
            }
            case CONFIRMED -> {
                if (s.confirmedAt() != DetectorState.UNSET && nowMs - s.confirmedAt() > t.maxConfirmedMs()) {
                    return cooldown(step, nowMs, "max_duration_timeout");
                }
                if (signal.observed() && signal.promptReady()) {
                    return cooldown(step, nowMs, "prompt_ready");
                }
                if (conf < t.endThreshold()) {
                    long since = step.startBelow(nowMs);
                    if (nowMs - since >= t.decayMs()) {
                        return cooldown(step, nowMs, "confidence_decay");
                    }
                } else {
                    step.belowSince = DetectorState.UNSET;
                }
            }
            case COOLDOWN -> {
                if (signal.observed() && aboveSuspect && multi) {
                    step.cooldownAt = DetectorState.UNSET;
                    return confirm(step, nowMs, "renewed_evidence");
                }
                if (nowMs - s.cooldownAt() >= t.cooldownMs()) {
                    step.cooldownAt = DetectorState.UNSET;
                    step.hits = new ArrayList<>();
                    return step.to(CompactionPhase.NONE, "cooldown_elapsed");
                }
            }
        }
        return step.stay();
    }

    private static Transition confirm(Step step, long nowMs, String reason) {
        step.confirmedAt = nowMs;
        step.aboveSince = DetectorState.UNSET;
        step.belowSince = DetectorState.UNSET;
        return step.to(CompactionPhase.CONFIRMED, reason);
    }

    private static Transition cooldown(Step step, long nowMs, String reason) {
        step.cooldownAt = nowMs;
        step.belowSince = DetectorState.UNSET;
        return step.to(CompactionPhase.COOLDOWN, reason);
    }

    private List<Long> recentHits(List<Long> hits, long nowMs) {
        List<Long> recent = new ArrayList<>(hits.size() + 1);
        for (Long h : hits) {
            if (nowMs - h < t.rapidWindowMs()) {
                recent.add(h);
            }
        }
        return recent;
    }

    /**
     * Mutable scratch copy of the fields a step may change.
     */
    private static final class Step {
        private final DetectorState from;
        private final double confidence;
        private final Set<SignalKind> signals;
        private final boolean aboveSuspect;

        long aboveSince;
        long belowSince;
        long confirmedAt;
        long cooldownAt;
        List<Long> hits;

        Step(DetectorState from, double confidence, Set<SignalKind> signals, boolean aboveSuspect) {
            this.from = from;
            this.confidence = confidence;
            this.signals = signals;
            this.aboveSuspect = aboveSuspect;
            this.aboveSince = from.aboveSince();
            this.belowSince = from.belowSince();
            this.confirmedAt = from.confirmedAt();
            this.cooldownAt = from.cooldownAt();
            this.hits = from.suspectHits();
        }

        long startAbove(long nowMs) {
            if (aboveSince == DetectorState.UNSET) {
                aboveSince = nowMs;
            }
            return aboveSince;
        }

        long startBelow(long nowMs) {
            if (belowSince == DetectorState.UNSET) {
                belowSince = nowMs;
            }
            return belowSince;
        }

        Transition to(CompactionPhase phase, String reason) {
            return new Transition(build(phase), from.phase(), phase, reason);
        }

        Transition stay() {
            return new Transition(build(from.phase()), from.phase(), from.phase(), null);
        }

        private DetectorState build(CompactionPhase phase) {
            return new DetectorState(phase, confidence, signals, aboveSince, belowSince,
                    confirmedAt, cooldownAt, hits, aboveSuspect);
        }
    }
}
