package com.questrail.kernel.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.EventJson;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * JSON wire format of a {@link TransportEnvelope}:
 *
 * <pre>
 *   {"version":1,"bridgeSeq":42,"bridgeTs":1700000000000,"direction":"producer->kernel","event":{...}}
 * </pre>
 *
 * One envelope per datagram. Decoding is strict about the envelope and lenient
 * about the event, which the normalizer validates later.
 */
public final class EnvelopeCodec {

    private EnvelopeCodec() {}

    public static byte[] encode(TransportEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        ObjectNode n = EventJson.objectNode();
        n.put("version", envelope.version());
        n.put("bridgeSeq", envelope.bridgeSeq());
        n.put("bridgeTs", envelope.bridgeTs());
        n.put("direction", envelope.direction().wireName());
        n.set("event", envelope.event());
        try {
            return EventJson.MAPPER.writeValueAsBytes(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope " + envelope.bridgeSeq() + " is not serializable", e);
        }
    }

    public static TransportEnvelope decode(byte[] datagram) throws EnvelopeDecodeException {
        if (datagram == null || datagram.length == 0) {
            throw new EnvelopeDecodeException("empty datagram");
        }
        JsonNode root;
        try {
            root = EventJson.MAPPER.readTree(datagram);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("malformed JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("envelope must be a JSON object");
        }

        int version = requireLong(root, "version").intValue();
        if (version != TransportEnvelope.VERSION) {
            throw new EnvelopeDecodeException("unsupported envelope version " + version);
        }
        long seq = requireLong(root, "bridgeSeq");
        if (seq < 1) {
            throw new EnvelopeDecodeException("bridgeSeq must be >= 1, got " + seq);
        }
        long ts = requireLong(root, "bridgeTs");

        String dir = EventJson.text(root, "direction");
        Optional<Direction> direction = Direction.fromWire(dir);
        if (direction.isEmpty()) {
            throw new EnvelopeDecodeException("unknown direction " + dir);
        }

        JsonNode event = root.get("event");
        if (event == null || !event.isObject()) {
            throw new EnvelopeDecodeException("event must be a JSON object");
        }
        return new TransportEnvelope(version, seq, ts, direction.get(), event);
    }

    private static Long requireLong(JsonNode root, String field) throws EnvelopeDecodeException {
        JsonNode v = root.get(field);
        if (v == null || !v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new EnvelopeDecodeException("missing or non-integer " + field);
        }
        return v.longValue();
    }
}
