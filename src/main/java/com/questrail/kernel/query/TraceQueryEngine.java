package com.questrail.kernel.query;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Span;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.store.EventFilter;
import com.questrail.kernel.store.EventStore;
import com.questrail.kernel.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * TraceQueryEngine
 * =============================================================================
 * {@link KernelQueryApi} over an {@link EventStore}.
 *
 * <h2>Read-only</h2>
 * Nothing here writes to the store. Open spans past the timeout are reported as
 * leaked, orphans and cycles are reported as found; none of them are repaired.
 *
 * <h2>Failure paths</h2>
 * A trace fails at its causally earliest event that
 * <ul>
 *   <li>has status {@code failed}, {@code dropped} or {@code timeout}, or</li>
 *   <li>is a {@code contract.violation} or {@code event.dropped}, or</li>
 *   <li>is an {@code inject.deferred} the trace never resumed.</li>
 * </ul>
 */
public final class TraceQueryEngine implements KernelQueryApi {
    private static final Logger log = LoggerFactory.getLogger(TraceQueryEngine.class);

    private final EventStore store;
    private final WallClock wallClock;
    private final Duration spanTimeout;

    public TraceQueryEngine(EventStore store, WallClock wallClock, Duration spanTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.spanTimeout = Objects.requireNonNull(spanTimeout, "spanTimeout");
    }

    // ---------------------------------------------------------------------
    // Trace reconstruction
    // ---------------------------------------------------------------------

    @Override
    public TraceView queryTrace(String traceId) {
        Objects.requireNonNull(traceId, "traceId");
        List<Event> arrival = store.queryByTrace(traceId, EventStore.TRACE_MAX_LIMIT);
        boolean truncated = arrival.size() >= EventStore.TRACE_MAX_LIMIT;
        if (truncated) {
            log.warn("Trace {} exceeds {} events; view is truncated", traceId, EventStore.TRACE_MAX_LIMIT);
        }

        CausalOrdering.Result ordering = CausalOrdering.order(arrival);
        List<Event> ordered = ordering.ordered();

        Map<Stage, Integer> stageCounts = new EnumMap<>(Stage.class);
        for (Event e : ordered) {
            stageCounts.merge(e.stage(), 1, Integer::sum);
        }

        return new TraceView(
                traceId,
                ordered,
                ordering.orphans(),
                stageCounts,
                hopLatencies(ordered),
                spanSummaries(traceId),
                store.edgesForTrace(traceId),
                ordering.cyclicEventIds(),
                truncated);
    }

    private static List<HopLatency> hopLatencies(List<Event> ordered) {
        Map<Stage, Event> first = firstPerStage(ordered);
        List<HopLatency> hops = new ArrayList<>(HopLatency.HOPS.size());
        for (HopLatency.Hop hop : HopLatency.HOPS) {
            Event a = first.get(hop.from());
            Event b = first.get(hop.to());
            if (a == null || b == null) {
                hops.add(new HopLatency(hop.from(), hop.to(), null, false));
            } else {
                long delta = b.timestamp() - a.timestamp();
                hops.add(new HopLatency(hop.from(), hop.to(), delta, delta < 0));
            }
        }
        return hops;
    }

    private List<SpanSummary> spanSummaries(String traceId) {
        long now = wallClock.nowMillis();
        long timeoutMs = spanTimeout.toMillis();
        List<SpanSummary> out = new ArrayList<>();
        for (Span s : store.spansForTrace(traceId)) {
            out.add(new SpanSummary(s, s.isOpen() && now - s.startedAt() > timeoutMs));
        }
        return out;
    }

    @Override
    public List<Event> queryEvents(EventFilter filter) {
        return store.queryByFilter(Objects.requireNonNull(filter, "filter"));
    }

    // ---------------------------------------------------------------------
    // Failure path
    // ---------------------------------------------------------------------

    @Override
    public List<FailurePath> queryFailurePath(FailureQuery query) {
        Objects.requireNonNull(query, "query");
        List<FailurePath> paths = new ArrayList<>();
        for (String traceId : candidateTraces(query)) {
            if (paths.size() >= query.limit()) {
                break;
            }
            List<Event> ordered = CausalOrdering.order(store.queryByTrace(traceId, EventStore.TRACE_MAX_LIMIT))
                    .ordered();
            Event failing = earliestFailing(ordered);
            if (failing == null) {
                continue;
            }
            FailureClassifier.Classification c = FailureClassifier.classify(failing, ordered);
            if (query.failureClass() != null && query.failureClass() != c.failureClass()) {
                continue;
            }
            paths.add(new FailurePath(traceId, failing,
                    CausalOrdering.descendants(ordered, failing.eventId()),
                    c.failureClass(), c.confidence(), c.inputs()));
        }
        return paths;
    }

    private Set<String> candidateTraces(FailureQuery query) {
        Set<String> traces = new LinkedHashSet<>();
        if (query.traceId() != null) {
            traces.add(query.traceId());
            return traces;
        }
        EventFilter.Builder filter = EventFilter.builder()
                .withTimeRange(query.fromTimestamp(), query.toTimestamp())
                .withLimit(EventFilter.MAX_LIMIT)
                .newestFirst();
        if (query.workerId() != null) {
            filter.withWorkerId(query.workerId());
        }
        for (Event e : store.queryByFilter(filter.build())) {
            if (mayFail(e)) {
                traces.add(e.traceId());
            }
        }
        return traces;
    }

    private static boolean mayFail(Event e) {
        return e.status().isFailure()
                || EventTypes.CONTRACT_VIOLATION.equals(e.type())
                || EventTypes.EVENT_DROPPED.equals(e.type())
                || EventTypes.INJECT_DEFERRED.equals(e.type());
    }

    static Event earliestFailing(List<Event> ordered) {
        boolean resumed = ordered.stream().anyMatch(e ->
                EventTypes.INJECT_RESUMED.equals(e.type()) || EventTypes.INJECT_APPLIED.equals(e.type()));
        for (Event e : ordered) {
            if (EventTypes.INJECT_DEFERRED.equals(e.type())) {
                if (!resumed) {
                    return e;
                }
            } else if (mayFail(e)) {
                return e;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Journey
    // ---------------------------------------------------------------------

    @Override
    public JourneyView queryJourney(String traceId) {
        Objects.requireNonNull(traceId, "traceId");
        List<Event> ordered = CausalOrdering.order(store.queryByTrace(traceId, EventStore.TRACE_MAX_LIMIT))
                .ordered();
        Map<Stage, Event> first = firstPerStage(ordered);
        Set<Stage> failed = new LinkedHashSet<>();
        for (Event e : ordered) {
            if (e.status().isFailure()) {
                failed.add(e.stage());
            }
        }

        List<Stage> stages = JourneyView.STAGES;
        int lastObserved = -1;
        for (int i = 0; i < stages.size(); i++) {
            if (first.containsKey(stages.get(i))) {
                lastObserved = i;
            }
        }

        List<JourneyStep> steps = new ArrayList<>(stages.size());
        Event previousSeen = null;
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            Event e = first.get(stage);
            if (e == null) {
                JourneyState state = i < lastObserved ? JourneyState.INFERRED : JourneyState.MISSING;
                steps.add(new JourneyStep(stage, state, null, null, null));
                continue;
            }
            Long delta = previousSeen == null ? null : e.timestamp() - previousSeen.timestamp();
            JourneyState state = failed.contains(stage) ? JourneyState.FAILED : JourneyState.SEEN;
            steps.add(new JourneyStep(stage, state, e.eventId(), e.timestamp(), delta));
            previousSeen = e;
        }
        return new JourneyView(traceId, steps);
    }

    private static Map<Stage, Event> firstPerStage(List<Event> ordered) {
        Map<Stage, Event> first = new EnumMap<>(Stage.class);
        for (Event e : ordered) {
            first.putIfAbsent(e.stage(), e);
        }
        return first;
    }
}
