package com.questrail.kernel.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task registered with a {@link MonotonicScheduler}.
 *
 * <p>The kernel uses these for defer TTLs, command acknowledgment deadlines
 * and the periodic maintenance ticks of the runtime.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         had already run or was cancelled before
     */
    boolean cancel();
}
