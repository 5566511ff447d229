package com.questrail.kernel.ingest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Remembers which event rooted each recent trace.
 *
 * <p>Bounded: the least recently touched traces are forgotten once
 * {@code capacity} is exceeded, after which a late duplicate root for such a
 * trace can no longer be diagnosed.</p>
 */
public final class TraceRootRegistry {

    private final Map<String, String> roots;

    public TraceRootRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.roots = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Claim the root of {@code traceId} for {@code eventId}.
     *
     * @return the event that already holds the root if it is a different one
     */
    public synchronized Optional<String> claim(String traceId, String eventId) {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(eventId, "eventId");
        String existing = roots.putIfAbsent(traceId, eventId);
        if (existing == null || existing.equals(eventId)) {
            return Optional.empty();
        }
        return Optional.of(existing);
    }

    public synchronized Optional<String> rootOf(String traceId) {
        return Optional.ofNullable(roots.get(traceId));
    }

    public synchronized int size() {
        return roots.size();
    }
}
