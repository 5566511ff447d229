package com.questrail.kernel.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>Used to stamp events with the producer's clock. Producers in other processes
 * may be skewed against this one; causal queries never rely on these values for
 * ordering.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
