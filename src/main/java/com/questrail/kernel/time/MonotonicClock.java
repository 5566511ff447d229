package com.questrail.kernel.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every timing decision the kernel makes.
 *
 * <h2>Binding invariant</h2>
 * Defer TTLs, detector sustain windows, span and acknowledgment timeouts are
 * measured on this clock. Wall-clock time ({@link WallClock}) is used only to
 * stamp events and never to decide whether a bound has expired.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Same tick expressed in milliseconds.
     */
    default long nowMillis()
    {
        return nowNanos() / 1_000_000L;
    }
}
