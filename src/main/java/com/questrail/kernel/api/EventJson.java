package com.questrail.kernel.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * EventJson
 * -----------------------------------------------------------------------------
 * Canonical JSON shape of an {@link Event}, shared by the durable store and the
 * bridge wire format.
 *
 * <p>Fields are written in a fixed order and {@code null} fields are omitted, so
 * the same event always serializes to the same bytes.</p>
 */
public final class EventJson {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private EventJson() {}

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    public static ObjectNode toJson(Event e) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("eventId", e.eventId());
        n.put("traceId", e.traceId());
        n.put("spanId", e.spanId());
        putIfPresent(n, "parentEventId", e.parentEventId());
        n.put("type", e.type());
        n.put("stage", e.stage().wireName());
        n.put("source", e.source());
        n.put("workerId", e.workerId());
        n.put("timestamp", e.timestamp());
        n.put("sequence", e.sequence());
        n.put("status", e.status().wireName());
        n.set("payload", e.payload());
        if (!e.evidenceRefs().isEmpty()) {
            n.set("evidenceRefs", evidenceToJson(e.evidenceRefs()));
        }
        putIfPresent(n, "correlationId", e.correlationId());
        putIfPresent(n, "causationId", e.causationId());
        if (e.spanGenerated()) {
            n.put("spanGenerated", true);
        }
        putIfPresent(n, "ackOfEventId", e.ackOfEventId());
        putIfPresent(n, "retryOfEventId", e.retryOfEventId());
        return n;
    }

    public static byte[] toBytes(Event e) {
        try {
            return MAPPER.writeValueAsBytes(toJson(e));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Event " + e.eventId() + " is not serializable", ex);
        }
    }

    public static String writeTree(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("JSON tree is not serializable", ex);
        }
    }

    /**
     * Parse a stored payload column. Anything that is not a JSON object is
     * wrapped as {@code {"value": ...}}.
     */
    public static ObjectNode readPayload(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return MAPPER.createObjectNode();
        }
        JsonNode node = MAPPER.readTree(json);
        if (node instanceof ObjectNode obj) {
            return obj;
        }
        ObjectNode wrapped = MAPPER.createObjectNode();
        wrapped.set("value", node);
        return wrapped;
    }

    public static ArrayNode evidenceToJson(List<EvidenceRef> refs) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (EvidenceRef r : refs) {
            ObjectNode o = arr.addObject();
            o.put("kind", r.kind());
            putIfPresent(o, "path", r.path());
            if (r.line() != null) {
                o.put("line", r.line());
            }
            putIfPresent(o, "hash", r.hash());
            putIfPresent(o, "note", r.note());
        }
        return arr;
    }

    /**
     * Items without a {@code kind} are skipped.
     */
    public static List<EvidenceRef> evidenceFromJson(JsonNode node) {
        List<EvidenceRef> refs = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return refs;
        }
        for (JsonNode item : node) {
            String kind = text(item, "kind");
            if (kind == null) {
                continue;
            }
            JsonNode line = item.get("line");
            refs.add(new EvidenceRef(
                    kind,
                    text(item, "path"),
                    line != null && line.canConvertToInt() ? line.intValue() : null,
                    text(item, "hash"),
                    text(item, "note")));
        }
        return refs;
    }

    /**
     * Non-blank text value of {@code field}, or {@code null}.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static void putIfPresent(ObjectNode n, String field, String value) {
        if (value != null) {
            n.put(field, value);
        }
    }
}
