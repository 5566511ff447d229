package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
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
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * BridgeReceiver
 * =============================================================================
 * Inbound half of a bridge link: decodes envelopes, checks each peer's sequence
 * and forwards the carried records to the ledger.
 *
 * <h2>Sequence tracking</h2>
 * <ul>
 *   <li>The first envelope from a peer sets its expected sequence.</li>
 *   <li>A forward jump emits {@code event.dropped} with reason
 *       {@code sequence_gap} and the missing range.</li>
 *   <li>A sequence slightly behind the expected one is a late or duplicated
 *       datagram. It is counted and its record still goes to the ledger, which
 *       rejects duplicates by event id. Tracking is unchanged.</li>
 *   <li>A restart at sequence 1, or a regression further back than
 *       {@value #REORDER_WINDOW}, means the peer restarted its counter; a
 *       {@code bridge.sequence.reset} is emitted and tracking continues from
 *       the new value.</li>
 * </ul>
 * Link loss does not reset tracking, so a gap spanning a disconnect is
 * reported after reconnect.
 *
 * <h2>Decode errors</h2>
 * Undecodable datagrams are counted and reported as {@code event.dropped} with
 * reason {@code decode_error}. Nothing from them reaches the ledger.
 */
public final class BridgeReceiver {
    private static final Logger log = LoggerFactory.getLogger(BridgeReceiver.class);

    public static final String SEQUENCE_GAP = "sequence_gap";
    public static final String DECODE_ERROR = "decode_error";
    public static final long REORDER_WINDOW = 64;

    private final Consumer<JsonNode> ledger;
    private final EventSink diagnostics;
    private final EventFactory events;
    private final KernelObservabilitySink observabilitySink;

    private final Map<String, Long> lastSeqByPeer = new HashMap<>();
    private long receivedCount;
    private long gapCount;
    private long missingCount;
    private long decodeErrors;
    private long sequenceResets;
    private long lateCount;

    /**
     * @param ledger      receives each carried record unchanged
     * @param diagnostics receives the receiver's own diagnostic events
     */
    public BridgeReceiver(Consumer<JsonNode> ledger,
                          EventSink diagnostics,
                          EventFactory events,
                          KernelObservabilitySink observabilitySink)
    {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.events = Objects.requireNonNull(events, "events");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public synchronized void onDatagram(SocketAddress remote, byte[] payload) {
        String peer = String.valueOf(remote);
        TransportEnvelope env;
        try {
            env = EnvelopeCodec.decode(payload);
        } catch (EnvelopeDecodeException e) {
            decodeErrors++;
            log.warn("Undecodable datagram from {}: {}", peer, e.getMessage());
            ObjectNode p = dropPayload(DECODE_ERROR, 1, peer);
            p.put("error", e.getMessage());
            emit(EventTypes.EVENT_DROPPED, EventStatus.DROPPED, p);
            report(DECODE_ERROR, peer + ": " + e.getMessage());
            return;
        }

        track(peer, env.bridgeSeq());
        receivedCount++;
        ledger.accept(env.event());
    }

    private void track(String peer, long seq) {
        Long last = lastSeqByPeer.get(peer);
        if (last == null) {
            lastSeqByPeer.put(peer, seq);
            return;
        }
        long expected = last + 1;
        if (seq < expected && seq != 1 && expected - seq <= REORDER_WINDOW) {
            lateCount++;
            log.debug("Late or duplicate envelope {} from {} (expected {})", seq, peer, expected);
            return;
        }
        lastSeqByPeer.put(peer, seq);
        if (seq > expected) {
            long missing = seq - expected;
            gapCount++;
            missingCount += missing;
            ObjectNode p = dropPayload(SEQUENCE_GAP, missing, peer);
            p.put("oldestSeq", expected);
            p.put("newestSeq", seq - 1);
            emit(EventTypes.EVENT_DROPPED, EventStatus.DROPPED, p);
            report(SEQUENCE_GAP, peer + " missing " + expected + ".." + (seq - 1));
        } else if (seq < expected) {
            sequenceResets++;
            ObjectNode p = EventJson.objectNode();
            p.put("peer", peer);
            p.put("previousSeq", last);
            p.put("bridgeSeq", seq);
            emit(EventTypes.BRIDGE_SEQUENCE_RESET, EventStatus.OK, p);
            report("sequence_reset", peer + " " + last + " -> " + seq);
        }
    }

    private static ObjectNode dropPayload(String reason, long count, String peer) {
        ObjectNode p = EventJson.objectNode();
        p.put("stage", BridgeSender.DROP_STAGE);
        p.put("reason", reason);
        p.put("droppedCount", count);
        p.put("peer", peer);
        return p;
    }

    private void emit(String type, EventStatus status, ObjectNode payload) {
        diagnostics.emit(events.builder(type, Stage.SYSTEM, TraceContext.origin("system"))
                .status(status)
                .payload(payload)
                .build());
    }

    private void report(String kind, String detail) {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(events.wallClock().now(), kind, detail));
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    /**
     * Last sequence seen from {@code remote}, or 0.
     */
    public synchronized long lastSeq(SocketAddress remote) {
        return lastSeqByPeer.getOrDefault(String.valueOf(remote), 0L);
    }

    public synchronized long receivedCount() {
        return receivedCount;
    }

    public synchronized long gapCount() {
        return gapCount;
    }

    public synchronized long missingCount() {
        return missingCount;
    }

    public synchronized long decodeErrors() {
        return decodeErrors;
    }

    public synchronized long sequenceResets() {
        return sequenceResets;
    }

    /**
     * Envelopes that arrived behind the expected sequence without resetting it.
     */
    public synchronized long lateCount() {
        return lateCount;
    }
}
