package com.questrail.kernel.store;

import com.questrail.kernel.api.Edge;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * EventStore
 * =============================================================================
 * Append-only, indexed log of canonical events with derived edges and spans.
 *
 * <h2>Writes</h2>
 * All mutations serialize through one append path. A duplicate {@code eventId}
 * is rejected and counted; the stored event is never overwritten. No append
 * waits longer than the configured busy timeout.
 *
 * <h2>Reads</h2>
 * Reads may run concurrently with the writer and only ever observe committed
 * events. Trace reads return events in arrival (commit) order; causal ordering
 * is the query engine's job.
 *
 * <h2>Retention</h2>
 * {@link #prune(long)} removes expired and over-cap events and cascades to the
 * edges and spans that referenced them.
 */
public interface EventStore extends AutoCloseable {

    int TRACE_DEFAULT_LIMIT = 1000;
    int TRACE_MAX_LIMIT = 5000;

    AppendResult append(Event event);

    /**
     * Best-effort batch: each event is appended independently.
     */
    default BatchResult appendBatch(List<Event> events) {
        List<AppendResult> results = new ArrayList<>(events.size());
        for (Event e : events) {
            results.add(append(e));
        }
        return new BatchResult(results);
    }

    Optional<Event> findById(String eventId);

    /**
     * Events of one trace in arrival order, at most {@code limit}
     * (clamped to {@value #TRACE_MAX_LIMIT}).
     */
    List<Event> queryByTrace(String traceId, int limit);

    default List<Event> queryByTrace(String traceId) {
        return queryByTrace(traceId, TRACE_DEFAULT_LIMIT);
    }

    List<Event> queryByFilter(EventFilter filter);

    List<Edge> edgesForTrace(String traceId);

    List<Span> spansForTrace(String traceId);

    /**
     * Spans still open that started before {@code cutoffMillis}.
     */
    List<Span> openSpansStartedBefore(long cutoffMillis, int limit);

    /**
     * Apply the retention policy relative to {@code nowMillis}.
     */
    PruneResult prune(long nowMillis);

    StoreStatus status();

    long size();

    @Override
    void close();
}
