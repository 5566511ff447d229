package com.questrail.kernel.observability;

import java.time.Instant;

/**
 * An unexpected failure inside a kernel loop or listener.
 */
public record KernelErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
