package com.questrail.kernel.query;

import com.questrail.kernel.api.Edge;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TraceView
 * -----------------------------------------------------------------------------
 * Reconstruction of one trace.
 *
 * @param events         every event of the trace, in causal order
 * @param orphans        events whose parent does not resolve in the trace
 * @param stageCounts    number of events per stage (stages without events are absent)
 * @param hops           latency for each pipeline hop
 * @param spans          span summaries with leak flags
 * @param edges          derived causal edges
 * @param cyclicEventIds events on or below a parent-link cycle
 * @param truncated      the trace had more events than a single query returns
 */
public record TraceView(
        String traceId,
        List<Event> events,
        List<OrphanRef> orphans,
        Map<Stage, Integer> stageCounts,
        List<HopLatency> hops,
        List<SpanSummary> spans,
        List<Edge> edges,
        List<String> cyclicEventIds,
        boolean truncated
) {
    public TraceView {
        Objects.requireNonNull(traceId, "traceId");
        events = List.copyOf(events);
        orphans = List.copyOf(orphans);
        stageCounts = stageCounts.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(stageCounts));
        hops = List.copyOf(hops);
        spans = List.copyOf(spans);
        edges = List.copyOf(edges);
        cyclicEventIds = List.copyOf(cyclicEventIds);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public boolean cyclic() {
        return !cyclicEventIds.isEmpty();
    }

    public int countFor(Stage stage) {
        return stageCounts.getOrDefault(stage, 0);
    }

    public List<SpanSummary> leakedSpans() {
        return spans.stream().filter(SpanSummary::leaked).toList();
    }
}
