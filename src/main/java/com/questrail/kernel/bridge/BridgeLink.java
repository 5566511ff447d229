package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.observability.TransportObservabilityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * BridgeLink
 * =============================================================================
 * Binds a {@link BridgeSender} and a {@link BridgeReceiver} to one
 * {@link DatagramEndpoint} and records the link's lifecycle in the local
 * ledger.
 *
 * <h2>Lifecycle events</h2>
 * <ul>
 *   <li>transport up: {@code bridge.connected}, then the {@code event.dropped}
 *       summaries of anything lost while down, then queued envelopes</li>
 *   <li>transport down: {@code bridge.disconnected}; later offers are dropped
 *       and summarized after reconnect</li>
 * </ul>
 * Both are emitted for worker {@code system}, which the contract engine applies
 * to every worker's bridge lane.
 *
 * <h2>Threading Model</h2>
 * Endpoint callbacks arrive serially on the transport thread. Sender and
 * receiver synchronize internally, so {@link #forward(Event)} may be called
 * from any thread.
 */
public final class BridgeLink implements DatagramEndpointListener {
    private static final Logger log = LoggerFactory.getLogger(BridgeLink.class);

    public static final String SOURCE = "kernel.bridge";

    private final DatagramEndpoint endpoint;
    private final BridgeSender sender;
    private final BridgeReceiver receiver;
    private final EventSink local;
    private final EventFactory events;
    private final KernelObservabilitySink observabilitySink;

    private volatile boolean up;
    private volatile boolean everUp;

    public BridgeLink(DatagramEndpoint endpoint,
                      BridgeSender sender,
                      BridgeReceiver receiver,
                      EventSink local,
                      EventFactory events,
                      KernelObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.local = Objects.requireNonNull(local, "local");
        this.events = Objects.requireNonNull(events, "events");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void start() {
        endpoint.setListener(this);
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    /**
     * Send a local event to the peer.
     *
     * @return {@code false} if it was dropped
     */
    public boolean forward(Event event) {
        boolean queued = sender.offer(event);
        sender.flush();
        return queued;
    }

    public boolean isUp() {
        return up;
    }

    // ---------------------------------------------------------------------
    // DatagramEndpointListener
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        boolean reconnect = everUp;
        up = true;
        everUp = true;

        ObjectNode p = EventJson.objectNode();
        p.put("peer", String.valueOf(sender.peer()));
        p.put("reconnect", reconnect);
        lifecycle(EventTypes.BRIDGE_CONNECTED, EventStatus.OK, p);
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                events.wallClock().now(), "link_up", String.valueOf(sender.peer())));

        sender.onLinkUp();
        sender.flush();
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (!up) {
            return;
        }
        up = false;
        sender.onLinkDown();

        String reason = cause == null ? "closed" : String.valueOf(cause.getMessage());
        ObjectNode p = EventJson.objectNode();
        p.put("peer", String.valueOf(sender.peer()));
        p.put("reason", reason);
        p.put("queueDepth", sender.queueDepth());
        p.put("lastBridgeSeq", sender.lastBridgeSeq());
        lifecycle(EventTypes.BRIDGE_DISCONNECTED, EventStatus.FAILED, p);
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                events.wallClock().now(), "link_down", reason));
        if (cause != null) {
            observabilitySink.onError(new KernelErrorEvent(events.wallClock().now(), "bridge transport failed", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        try {
            receiver.onDatagram(remote, payload);
        } catch (RuntimeException e) {
            log.error("Bridge receiver failed on datagram from {}", remote, e);
            observabilitySink.onError(new KernelErrorEvent(events.wallClock().now(), "bridge receive failed", e));
        }
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    public BridgeDiagnostics diagnostics() {
        return new BridgeDiagnostics(
                up,
                sender.forwardedCount(),
                sender.droppedCount(),
                sender.queueDepth(),
                sender.lastBridgeSeq(),
                sender.lastForwardedAt(),
                sender.lastDroppedAt(),
                sender.pendingDropGroups(),
                receiver.receivedCount(),
                receiver.gapCount(),
                receiver.missingCount(),
                receiver.decodeErrors(),
                receiver.sequenceResets(),
                receiver.lateCount());
    }

    /**
     * Record the current counters as a {@code bridge.stats} event.
     */
    public Event publishStats() {
        Event stats = events.builder(EventTypes.BRIDGE_STATS, Stage.SYSTEM, TraceContext.origin("system"))
                .payload(diagnostics().toPayload())
                .build();
        local.emit(stats);
        return stats;
    }

    private void lifecycle(String type, EventStatus status, ObjectNode payload) {
        local.emit(events.builder(type, Stage.SYSTEM, TraceContext.origin("system"))
                .status(status)
                .payload(payload)
                .build());
    }
}
