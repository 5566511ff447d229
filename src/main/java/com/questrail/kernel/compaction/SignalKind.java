package com.questrail.kernel.compaction;

import java.util.Locale;

/**
 * Independent kinds of evidence that the driven program is compacting.
 */
public enum SignalKind {
    /** Output mentions compaction, summarizing or the context window. */
    LEXICAL,
    /** Output has the shape of a summary: a heading or a run of bullet lines. */
    STRUCTURED,
    /** Several output chunks in a row without a prompt. */
    BURST_NO_PROMPT,
    /** No injection into the worker recently, so the output is unprompted. */
    NO_CAUSATION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
