package com.questrail.kernel.query;

/**
 * What the ledger shows for one pipeline stage of a trace.
 */
public enum JourneyState {
    /** At least one event, none failing. */
    SEEN,
    /** No event, and no later stage observed either. */
    MISSING,
    /** At least one event with status failed, dropped or timeout. */
    FAILED,
    /** No event, but a later stage was observed so this one must have happened. */
    INFERRED
}
