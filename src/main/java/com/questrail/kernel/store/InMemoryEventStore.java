package com.questrail.kernel.store;

import com.questrail.kernel.api.Edge;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.Span;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Non-durable {@link EventStore}: the fallback when the durable ledger cannot be
 * opened or durability is switched off.
 *
 * <p>Maps are guarded by a read/write lock so readers see whole commits. Map
 * iteration order is arrival order.</p>
 */
public final class InMemoryEventStore extends AbstractEventStore {

    private final ReadWriteLock dataLock = new ReentrantReadWriteLock();
    private final LinkedHashMap<String, Event> events = new LinkedHashMap<>();
    private final Map<String, List<String>> traceIndex = new HashMap<>();
    private final Map<String, Set<Edge>> edgesByTrace = new HashMap<>();
    private final LinkedHashMap<String, Span> spans = new LinkedHashMap<>();

    private final String degradedReason;

    public InMemoryEventStore(RetentionPolicy retention, Duration busyTimeout, String degradedReason) {
        super(retention, busyTimeout);
        this.degradedReason = degradedReason;
    }

    public InMemoryEventStore() {
        this(RetentionPolicy.defaults(), Duration.ofSeconds(5), null);
    }

    // ---------------------------------------------------------------------
    // Write hooks
    // ---------------------------------------------------------------------

    @Override
    protected boolean containsEvent(String eventId) {
        dataLock.readLock().lock();
        try {
            return events.containsKey(eventId);
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    protected Span findSpan(String spanId) {
        dataLock.readLock().lock();
        try {
            return spans.get(spanId);
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    protected void insert(Event event, List<Edge> edges, Span span) {
        dataLock.writeLock().lock();
        try {
            events.put(event.eventId(), event);
            traceIndex.computeIfAbsent(event.traceId(), t -> new ArrayList<>()).add(event.eventId());
            if (!edges.isEmpty()) {
                edgesByTrace.computeIfAbsent(event.traceId(), t -> new LinkedHashSet<>()).addAll(edges);
            }
            spans.put(span.spanId(), span);
        } finally {
            dataLock.writeLock().unlock();
        }
    }

    @Override
    protected PruneResult pruneOlderThan(long cutoffMillis, long maxRows) {
        dataLock.writeLock().lock();
        try {
            Set<String> removed = new HashSet<>();
            long expired = 0;
            for (Iterator<Event> it = events.values().iterator(); it.hasNext(); ) {
                Event e = it.next();
                if (e.timestamp() < cutoffMillis) {
                    it.remove();
                    removed.add(e.eventId());
                    expired++;
                }
            }

            long overCap = 0;
            for (Iterator<Event> it = events.values().iterator(); it.hasNext() && events.size() > maxRows; ) {
                Event e = it.next();
                it.remove();
                removed.add(e.eventId());
                overCap++;
            }
            if (removed.isEmpty()) {
                return PruneResult.NONE;
            }

            traceIndex.values().forEach(ids -> ids.removeIf(removed::contains));
            traceIndex.values().removeIf(List::isEmpty);

            long edgesRemoved = 0;
            for (Set<Edge> set : edgesByTrace.values()) {
                int before = set.size();
                set.removeIf(edge -> removed.contains(edge.fromEventId()) || removed.contains(edge.toEventId()));
                edgesRemoved += before - set.size();
            }
            edgesByTrace.values().removeIf(Set::isEmpty);

            Set<String> liveSpans = events.values().stream().map(Event::spanId).collect(Collectors.toSet());
            int spansBefore = spans.size();
            spans.keySet().removeIf(id -> !liveSpans.contains(id));

            return new PruneResult(expired, overCap, edgesRemoved, spansBefore - spans.size());
        } finally {
            dataLock.writeLock().unlock();
        }
    }

    @Override
    protected boolean isDurable() {
        return false;
    }

    @Override
    protected String backendName() {
        return "memory";
    }

    @Override
    protected String degradedReason() {
        return degradedReason;
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public Optional<Event> findById(String eventId) {
        dataLock.readLock().lock();
        try {
            return Optional.ofNullable(events.get(eventId));
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Event> queryByTrace(String traceId, int limit) {
        int max = Math.min(limit <= 0 ? TRACE_DEFAULT_LIMIT : limit, TRACE_MAX_LIMIT);
        dataLock.readLock().lock();
        try {
            List<String> ids = traceIndex.getOrDefault(traceId, List.of());
            return ids.stream().limit(max).map(events::get).collect(Collectors.toList());
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Event> queryByFilter(EventFilter filter) {
        Comparator<Event> byTimestamp = Comparator.comparingLong(Event::timestamp);
        dataLock.readLock().lock();
        try {
            List<Event> candidates = new ArrayList<>(events.values());
            if (filter.newestFirst()) {
                // Reversed before the stable sort so ties come out newest arrival first.
                Collections.reverse(candidates);
                byTimestamp = byTimestamp.reversed();
            }
            return candidates.stream()
                    .filter(filter::matches)
                    .sorted(byTimestamp)
                    .limit(filter.limit())
                    .collect(Collectors.toList());
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Edge> edgesForTrace(String traceId) {
        dataLock.readLock().lock();
        try {
            return List.copyOf(edgesByTrace.getOrDefault(traceId, Set.of()));
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Span> spansForTrace(String traceId) {
        dataLock.readLock().lock();
        try {
            return spans.values().stream()
                    .filter(s -> s.traceId().equals(traceId))
                    .collect(Collectors.toList());
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Span> openSpansStartedBefore(long cutoffMillis, int limit) {
        dataLock.readLock().lock();
        try {
            return spans.values().stream()
                    .filter(s -> s.isOpen() && s.startedAt() < cutoffMillis)
                    .limit(limit)
                    .collect(Collectors.toList());
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        dataLock.readLock().lock();
        try {
            return events.size();
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        // Nothing to release.
    }
}
