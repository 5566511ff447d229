package com.questrail.kernel.store;

public enum AppendStatus {
    /** Committed and visible to readers. */
    INSERTED,
    /** Rejected: the event id is already in the store. */
    DUPLICATE,
    /** Rejected: the event failed structural validation. */
    INVALID,
    /** Rejected: the write path stayed contended past the busy timeout. */
    BUSY,
    /** Rejected: the backing store raised an error. */
    FAILED
}
