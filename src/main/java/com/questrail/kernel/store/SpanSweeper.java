package com.questrail.kernel.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Span;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Closes spans that outlive the span timeout by recording a {@code span.timeout}
 * event in the span itself.
 *
 * <p>Age is measured against event timestamps, so a sweep uses the wall clock.
 * The timeout event carries terminal status {@code timeout}, which closes the span
 * when it is committed. Until then the span is remembered so a second sweep does
 * not report it again.</p>
 */
public final class SpanSweeper {
    private static final Logger log = LoggerFactory.getLogger(SpanSweeper.class);

    private static final int BATCH = 500;
    private static final int REMEMBERED = 10_000;

    private final EventStore store;
    private final EventSink sink;
    private final EventFactory events;
    private final Duration spanTimeout;

    private final Set<String> swept = new LinkedHashSet<>();

    public SpanSweeper(EventStore store, EventSink sink, EventFactory events, Duration spanTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.spanTimeout = Objects.requireNonNull(spanTimeout, "spanTimeout");
        if (spanTimeout.isNegative() || spanTimeout.isZero()) {
            throw new IllegalArgumentException("spanTimeout must be > 0");
        }
    }

    /**
     * @return number of {@code span.timeout} events emitted
     */
    public synchronized int sweep() {
        long now = events.wallClock().nowMillis();
        long cutoff = now - spanTimeout.toMillis();
        int emitted = 0;
        for (Span span : store.openSpansStartedBefore(cutoff, BATCH)) {
            if (!swept.add(span.spanId())) {
                continue;
            }
            trim();
            sink.emit(timeoutFor(span, now));
            emitted++;
        }
        if (emitted > 0) {
            log.info("{} spans timed out after {}ms", emitted, spanTimeout.toMillis());
        }
        return emitted;
    }

    private Event timeoutFor(Span span, long now) {
        String lastEventId = lastEventOf(span);

        ObjectNode payload = EventJson.objectNode();
        payload.put("openedAt", span.startedAt());
        payload.put("ageMs", now - span.startedAt());
        payload.put("timeoutMs", spanTimeout.toMillis());
        payload.put("eventCount", span.eventCount());

        return events.builder(EventTypes.SPAN_TIMEOUT, span.stage(),
                        TraceContext.of(span.traceId(), lastEventId, span.workerId()))
                .spanId(span.spanId())
                .status(EventStatus.TIMEOUT)
                .payload(payload)
                .build();
    }

    private String lastEventOf(Span span) {
        List<Event> trace = store.queryByTrace(span.traceId());
        String last = null;
        for (Event e : trace) {
            if (e.spanId().equals(span.spanId())) {
                last = e.eventId();
            }
        }
        return last;
    }

    private void trim() {
        Iterator<String> it = swept.iterator();
        while (swept.size() > REMEMBERED && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
