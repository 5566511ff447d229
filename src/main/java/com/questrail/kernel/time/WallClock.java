package com.questrail.kernel.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Producer clock used for event timestamps and retention cut-offs.
 *
 * <p>It may jump due to NTP or manual adjustment and MUST NOT be used to measure
 * defer TTLs or detector windows.</p>
 */
public interface WallClock
{
    Instant now();

    /**
     * Epoch milliseconds, the unit of {@code Event.timestamp()}.
     */
    default long nowMillis()
    {
        return now().toEpochMilli();
    }
}
