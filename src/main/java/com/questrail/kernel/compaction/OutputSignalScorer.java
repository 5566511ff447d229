package com.questrail.kernel.compaction;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores one worker's terminal output chunks for compaction evidence.
 *
 * <p>Stateful: it counts chunks since the last prompt and remembers the last
 * injection into the worker. One instance per worker; not thread-safe.</p>
 */
public final class OutputSignalScorer {

    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-9;?]*[ -/]*[@-~]|\u001B\\][^\u0007]*\u0007");

    private static final List<Pattern> LEXICAL = List.of(
            Pattern.compile("compacting", Pattern.CASE_INSENSITIVE),
            Pattern.compile("summariz(e|ing) (the |your |this )?conversation", Pattern.CASE_INSENSITIVE),
            Pattern.compile("context window", Pattern.CASE_INSENSITIVE),
            Pattern.compile("truncat(e|ed|ing) (the |earlier |previous )?messages", Pattern.CASE_INSENSITIVE),
            Pattern.compile("conversation (is )?(too |very )?long", Pattern.CASE_INSENSITIVE),
            Pattern.compile("reducing context", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> STRUCTURED = List.of(
            Pattern.compile("^#{1,3}\\s+summary", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE),
            Pattern.compile("^[-*]\\s+.{10,}\\n^[-*]\\s+.{10,}\\n^[-*]\\s+.{10,}",
                    Pattern.MULTILINE | Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> PROMPT = List.of(
            Pattern.compile("[$>]\\s*$", Pattern.MULTILINE),
            Pattern.compile("(^|\\n)>\\s*(\\n|$)", Pattern.MULTILINE));

    private final CompactionThresholds thresholds;
    private int chunksSincePrompt;
    private long lastInjectMs = Long.MIN_VALUE;

    public OutputSignalScorer(CompactionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * @param chunk raw terminal output, escape sequences included
     * @param nowMs monotonic milliseconds
     */
    public CompactionSignal score(String chunk, long nowMs) {
        String text = strip(chunk == null ? "" : chunk);
        boolean promptReady = matchesAny(PROMPT, text);

        Set<SignalKind> kinds = EnumSet.noneOf(SignalKind.class);
        if (matchesAny(LEXICAL, text)) {
            kinds.add(SignalKind.LEXICAL);
        }
        if (matchesAny(STRUCTURED, text)) {
            kinds.add(SignalKind.STRUCTURED);
        }

        if (promptReady) {
            chunksSincePrompt = 0;
        } else {
            chunksSincePrompt++;
            if (chunksSincePrompt >= thresholds.burstChunks()) {
                kinds.add(SignalKind.BURST_NO_PROMPT);
            }
        }

        boolean caused = lastInjectMs != Long.MIN_VALUE && nowMs - lastInjectMs < thresholds.causationWindowMs();
        if (!caused && !text.isBlank()) {
            kinds.add(SignalKind.NO_CAUSATION);
        }

        double score = 0.0;
        for (SignalKind k : kinds) {
            score += thresholds.weight(k);
        }
        return CompactionSignal.of(kinds, Math.min(1.0, score), promptReady);
    }

    public void onInjectRequested(long nowMs) {
        lastInjectMs = nowMs;
    }

    public void reset() {
        chunksSincePrompt = 0;
        lastInjectMs = Long.MIN_VALUE;
    }

    static String strip(String chunk) {
        return ANSI.matcher(chunk).replaceAll("").replace("\r", "");
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
