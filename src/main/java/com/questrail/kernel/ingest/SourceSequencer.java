package com.questrail.kernel.ingest;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-source monotonic sequence counters.
 *
 * <p>Assigns sequences to producers that did not number their own events and
 * keeps the counter ahead of any sequence a producer did supply.</p>
 */
public final class SourceSequencer {

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public long next(String source) {
        return counter(source).incrementAndGet();
    }

    /**
     * Record a producer-assigned sequence.
     */
    public void observe(String source, long sequence) {
        counter(source).accumulateAndGet(sequence, Math::max);
    }

    public long current(String source) {
        AtomicLong c = counters.get(source);
        return c == null ? 0 : c.get();
    }

    private AtomicLong counter(String source) {
        return counters.computeIfAbsent(source, s -> new AtomicLong());
    }
}
