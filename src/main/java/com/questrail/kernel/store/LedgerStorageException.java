package com.questrail.kernel.store;

/**
 * Failure of the backing store. Never propagated to producers: the append path
 * turns it into a failed {@link AppendResult} and startup turns it into
 * in-memory mode.
 */
public class LedgerStorageException extends RuntimeException {
    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
