package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventClass;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTaxonomy;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.observability.TransportObservabilityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * BridgeSender
 * =============================================================================
 * Outbound half of a bridge link: sequences events into envelopes, queues them
 * and transmits them to one peer.
 *
 * <h2>Sequencing</h2>
 * Every offered event gets the next {@code bridgeSeq} when its envelope is
 * built, whether or not it is ever transmitted. A dropped envelope therefore
 * leaves a gap the peer can see, and the drop summary names the same range.
 *
 * <h2>Drops</h2>
 * <ul>
 *   <li>While the link is down every offer is dropped ({@code link_down}).</li>
 *   <li>When the queue is full the oldest queued telemetry envelope is evicted,
 *       else incoming telemetry is dropped, else the envelope is admitted past
 *       capacity ({@code queue_overflow}).</li>
 * </ul>
 * Pending drop groups become {@code event.dropped} summaries. Each summary is
 * committed to the local ledger and queued as an envelope, at reconnect for
 * link-down losses and otherwise directly ahead of the next envelope offered.
 *
 * <h2>Threading Model</h2>
 * All public methods are synchronized.
 */
public final class BridgeSender {
    private static final Logger log = LoggerFactory.getLogger(BridgeSender.class);

    public static final String DROP_STAGE = "transport";
    public static final String LINK_DOWN = "link_down";
    public static final String QUEUE_OVERFLOW = "queue_overflow";

    private record Queued(TransportEnvelope envelope, boolean droppable) {}

    private final DatagramEndpoint endpoint;
    private final SocketAddress peer;
    private final Direction direction;
    private final int capacity;
    private final EventSink local;
    private final EventFactory events;
    private final KernelObservabilitySink observabilitySink;

    private final Deque<Queued> queue = new ArrayDeque<>();
    private final DropGroups drops = new DropGroups();

    private boolean linkUp;
    private long nextSeq = 1;
    private long forwardedCount;
    private long lastForwardedAt;
    private long lastDroppedAt;

    public BridgeSender(DatagramEndpoint endpoint,
                        SocketAddress peer,
                        Direction direction,
                        int capacity,
                        EventSink local,
                        EventFactory events,
                        KernelObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.peer = Objects.requireNonNull(peer, "peer");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.local = Objects.requireNonNull(local, "local");
        this.events = Objects.requireNonNull(events, "events");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    // ---------------------------------------------------------------------
    // Offer / flush
    // ---------------------------------------------------------------------

    /**
     * @return {@code true} if the event was queued for transmission
     */
    public synchronized boolean offer(Event event) {
        Objects.requireNonNull(event, "event");
        return enqueue(EventJson.toJson(event), event.eventClass());
    }

    /**
     * Offer a raw record from a producer that does not build canonical events.
     */
    public synchronized boolean offerRaw(JsonNode record) {
        Objects.requireNonNull(record, "record");
        String type = EventJson.text(record, "type");
        return enqueue(record.deepCopy(), type != null ? EventTaxonomy.classify(type) : EventClass.SYSTEM);
    }

    /**
     * Transmit every queued envelope while the link is up.
     *
     * @return the number of envelopes handed to the endpoint
     */
    public synchronized int flush() {
        int sent = 0;
        while (linkUp && !queue.isEmpty()) {
            TransportEnvelope env = queue.poll().envelope();
            endpoint.send(peer, EnvelopeCodec.encode(env));
            forwardedCount++;
            lastForwardedAt = events.wallClock().nowMillis();
            sent++;
        }
        return sent;
    }

    private boolean enqueue(JsonNode record, EventClass cls) {
        if (!linkUp) {
            drop(nextSeq++, LINK_DOWN);
            return false;
        }
        flushDropSummaries();

        TransportEnvelope env = envelope(record);
        boolean droppable = cls.isDroppable();
        if (queue.size() >= capacity) {
            if (!evictOldestTelemetry()) {
                if (droppable) {
                    drop(env.bridgeSeq(), QUEUE_OVERFLOW);
                    return false;
                }
                log.debug("Bridge queue over capacity; admitting {} envelope {}", cls, env.bridgeSeq());
            }
        }
        queue.add(new Queued(env, droppable));
        return true;
    }

    private boolean evictOldestTelemetry() {
        Iterator<Queued> it = queue.iterator();
        while (it.hasNext()) {
            Queued q = it.next();
            if (q.droppable()) {
                it.remove();
                drop(q.envelope().bridgeSeq(), QUEUE_OVERFLOW);
                return true;
            }
        }
        return false;
    }

    private void flushDropSummaries() {
        if (drops.isEmpty()) {
            return;
        }
        for (DropGroups.Group g : drops.drain()) {
            Event summary = events.builder(EventTypes.EVENT_DROPPED, Stage.SYSTEM, TraceContext.origin("system"))
                    .status(EventStatus.DROPPED)
                    .payload(g.toPayload())
                    .build();
            local.emit(summary);
            queue.add(new Queued(envelope(EventJson.toJson(summary)), false));
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    events.wallClock().now(), "dropped",
                    g.droppedCount() + " envelope(s) " + g.reason() + " seq " + g.oldestSeq() + ".." + g.newestSeq()));
        }
    }

    private TransportEnvelope envelope(JsonNode record) {
        return TransportEnvelope.of(nextSeq++, events.wallClock().nowMillis(), direction, record);
    }

    private void drop(long seq, String reason) {
        drops.record(DROP_STAGE, reason, seq);
        lastDroppedAt = events.wallClock().nowMillis();
    }

    // ---------------------------------------------------------------------
    // Link state
    // ---------------------------------------------------------------------

    /**
     * Losses recorded while the link was down are summarized now, ahead of
     * anything offered after reconnect.
     */
    public synchronized void onLinkUp() {
        linkUp = true;
        flushDropSummaries();
    }

    /**
     * Queued envelopes stay queued and go out after reconnect.
     */
    public synchronized void onLinkDown() {
        linkUp = false;
    }

    public synchronized boolean isLinkUp() {
        return linkUp;
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    public synchronized int queueDepth() {
        return queue.size();
    }

    public synchronized long lastBridgeSeq() {
        return nextSeq - 1;
    }

    public synchronized long forwardedCount() {
        return forwardedCount;
    }

    public synchronized long droppedCount() {
        return drops.totalDropped();
    }

    public synchronized int pendingDropGroups() {
        return drops.pendingGroups();
    }

    synchronized long lastForwardedAt() {
        return lastForwardedAt;
    }

    synchronized long lastDroppedAt() {
        return lastDroppedAt;
    }

    public SocketAddress peer() {
        return peer;
    }
}
