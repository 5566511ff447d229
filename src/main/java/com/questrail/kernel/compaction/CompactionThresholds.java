package com.questrail.kernel.compaction;

/**
 * CompactionThresholds
 * -----------------------------------------------------------------------------
 * Weights, thresholds and timings of the compaction detector. All times are in
 * milliseconds on the monotonic clock.
 *
 * @param minSignalKinds  distinct signal kinds required for any upward transition
 * @param endThreshold    confidence below which a confirmed compaction decays
 * @param burstChunks     chunks without a prompt before the burst signal fires
 * @param causationWindowMs output this soon after an injection is caused by it
 */
public record CompactionThresholds(
        double lexicalWeight,
        double structuredWeight,
        double burstWeight,
        double noCausationWeight,
        double suspectThreshold,
        double confirmThreshold,
        double endThreshold,
        long suspectSustainMs,
        long confirmSustainMs,
        long decayMs,
        long cooldownMs,
        long rapidWindowMs,
        int rapidCount,
        long maxConfirmedMs,
        int minSignalKinds,
        int burstChunks,
        long causationWindowMs
) {
    public CompactionThresholds {
        if (suspectThreshold <= 0 || confirmThreshold < suspectThreshold || endThreshold > suspectThreshold) {
            throw new IllegalArgumentException("thresholds must satisfy 0 < end <= suspect <= confirm");
        }
        if (minSignalKinds < 1 || rapidCount < 1 || burstChunks < 1) {
            throw new IllegalArgumentException("counts must be >= 1");
        }
    }

    public static CompactionThresholds defaults() {
        return new CompactionThresholds(
                0.3, 0.5, 0.3, 0.2,
                0.3, 0.6, 0.2,
                300, 800, 500, 1500,
                2000, 3,
                30_000,
                2,
                5,
                10_000);
    }

    public double weight(SignalKind kind) {
        return switch (kind) {
            case LEXICAL -> lexicalWeight;
            case STRUCTURED -> structuredWeight;
            case BURST_NO_PROMPT -> burstWeight;
            case NO_CAUSATION -> noCausationWeight;
        };
    }
}
