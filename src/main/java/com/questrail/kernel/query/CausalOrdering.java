package com.questrail.kernel.query;

import com.questrail.kernel.api.Event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CausalOrdering
 * =============================================================================
 * Orders the events of one trace by their parent links.
 *
 * <h2>Rank</h2>
 * An event's causal rank is its depth below a trace root. Roots are events with
 * no parent and events whose parent does not resolve inside the trace (orphans).
 * Every event therefore sorts after its resolvable parent.
 *
 * <h2>Ties</h2>
 * Events of equal rank keep their arrival order at the store, except that events
 * from the same source are placed in ascending {@code sequence} within the slots
 * that source occupies. Producer timestamps are never consulted, so clock skew
 * between processes cannot reorder causes and effects.
 *
 * <h2>Cycles</h2>
 * Events that cannot be reached from any root sit on (or below) a parent-link
 * cycle. They are appended after the ordered events, in arrival order, and
 * reported separately.
 *
 * <p>This class is pure and stateless.</p>
 */
public final class CausalOrdering {

    private CausalOrdering() {}

    public record Result(List<Event> ordered, List<OrphanRef> orphans, List<String> cyclicEventIds) {
        public Result {
            ordered = List.copyOf(ordered);
            orphans = List.copyOf(orphans);
            cyclicEventIds = List.copyOf(cyclicEventIds);
        }

        public boolean cyclic() {
            return !cyclicEventIds.isEmpty();
        }
    }

    /**
     * @param arrival events of one trace in store arrival order
     */
    public static Result order(List<Event> arrival) {
        Map<String, Event> byId = new LinkedHashMap<>();
        Map<String, Integer> arrivalIndex = new HashMap<>();
        for (Event e : arrival) {
            if (byId.putIfAbsent(e.eventId(), e) == null) {
                arrivalIndex.put(e.eventId(), arrivalIndex.size());
            }
        }

        Map<String, List<Event>> children = new HashMap<>();
        List<Event> roots = new ArrayList<>();
        List<OrphanRef> orphans = new ArrayList<>();
        for (Event e : byId.values()) {
            String parent = e.parentEventId();
            if (parent == null) {
                roots.add(e);
            } else if (!byId.containsKey(parent)) {
                roots.add(e);
                orphans.add(new OrphanRef(e.eventId(), parent));
            } else {
                children.computeIfAbsent(parent, p -> new ArrayList<>()).add(e);
            }
        }

        // Breadth-first from the roots; each event has at most one parent, so
        // the first visit fixes its depth.
        Map<String, Integer> rank = new HashMap<>();
        Deque<Event> frontier = new ArrayDeque<>();
        for (Event r : roots) {
            rank.put(r.eventId(), 0);
            frontier.add(r);
        }
        int maxRank = 0;
        while (!frontier.isEmpty()) {
            Event e = frontier.poll();
            int next = rank.get(e.eventId()) + 1;
            for (Event child : children.getOrDefault(e.eventId(), List.of())) {
                if (rank.putIfAbsent(child.eventId(), next) == null) {
                    maxRank = Math.max(maxRank, next);
                    frontier.add(child);
                }
            }
        }

        List<List<Event>> layers = new ArrayList<>(maxRank + 1);
        for (int i = 0; i <= maxRank; i++) {
            layers.add(new ArrayList<>());
        }
        List<String> cyclic = new ArrayList<>();
        List<Event> unreachable = new ArrayList<>();
        for (Event e : byId.values()) {
            Integer r = rank.get(e.eventId());
            if (r == null) {
                cyclic.add(e.eventId());
                unreachable.add(e);
            } else {
                layers.get(r).add(e);
            }
        }

        List<Event> ordered = new ArrayList<>(byId.size());
        for (List<Event> layer : layers) {
            ordered.addAll(sequenceWithinSource(layer, arrivalIndex));
        }
        ordered.addAll(unreachable);
        return new Result(ordered, orphans, cyclic);
    }

    /**
     * Keeps the arrival interleaving of sources but refills each source's slots
     * with that source's events in ascending sequence.
     */
    static List<Event> sequenceWithinSource(List<Event> layer, Map<String, Integer> arrivalIndex) {
        if (layer.size() < 2) {
            return layer;
        }
        Map<String, List<Event>> bySource = new LinkedHashMap<>();
        for (Event e : layer) {
            bySource.computeIfAbsent(e.source(), s -> new ArrayList<>()).add(e);
        }
        Comparator<Event> bySequence = Comparator.<Event>comparingLong(Event::sequence)
                .thenComparing(e -> arrivalIndex.getOrDefault(e.eventId(), Integer.MAX_VALUE));
        Map<String, Deque<Event>> sorted = new HashMap<>();
        bySource.forEach((source, events) -> {
            List<Event> copy = new ArrayList<>(events);
            copy.sort(bySequence);
            sorted.put(source, new ArrayDeque<>(copy));
        });

        List<Event> out = new ArrayList<>(layer.size());
        for (Event slot : layer) {
            out.add(sorted.get(slot.source()).poll());
        }
        return out;
    }

    /**
     * Every event below {@code rootEventId}, in {@code ordered} order.
     */
    public static List<Event> descendants(List<Event> ordered, String rootEventId) {
        Set<String> reached = new LinkedHashSet<>();
        reached.add(rootEventId);
        List<Event> out = new ArrayList<>();
        for (Event e : ordered) {
            if (e.parentEventId() != null && reached.contains(e.parentEventId())
                    && !e.eventId().equals(rootEventId)) {
                if (reached.add(e.eventId())) {
                    out.add(e);
                }
            }
        }
        return out;
    }
}
