package com.questrail.kernel.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Event
 * =============================================================================
 * Canonical, immutable unit of the evidence ledger.
 *
 * <h2>Identity and causality</h2>
 * <ul>
 *   <li>{@code eventId} is unique for the lifetime of a store</li>
 *   <li>{@code traceId} groups every event of one end-to-end operation</li>
 *   <li>{@code parentEventId} is the direct cause, or {@code null} for a root;
 *       a parent that does not resolve within the trace is reported as an
 *       orphan by the query engine and is never rewritten</li>
 *   <li>{@code ackOfEventId} and {@code retryOfEventId} are explicit edge hints</li>
 * </ul>
 *
 * <h2>Compatibility mirrors</h2>
 * {@code correlationId} and {@code causationId} carry the legacy field values a
 * producer sent. They are kept for the compatibility window and are never used
 * for ordering.
 *
 * <h2>Payload</h2>
 * The payload is an opaque JSON object. It is copied on the way in and on the
 * way out, so an event read back from a store cannot be changed by its reader.
 */
public record Event(
        String eventId,
        String traceId,
        String spanId,
        String parentEventId,
        String type,
        Stage stage,
        String source,
        String workerId,
        long timestamp,
        long sequence,
        EventStatus status,
        ObjectNode payload,
        List<EvidenceRef> evidenceRefs,
        String correlationId,
        String causationId,
        boolean spanGenerated,
        String ackOfEventId,
        String retryOfEventId
) {
    public Event {
        requireText(eventId, "eventId");
        requireText(traceId, "traceId");
        requireText(spanId, "spanId");
        requireText(type, "type");
        Objects.requireNonNull(stage, "stage");
        requireText(source, "source");
        requireText(workerId, "workerId");
        Objects.requireNonNull(status, "status");
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    public EventClass eventClass() {
        return EventTaxonomy.classify(type);
    }

    public boolean hasParent() {
        return parentEventId != null;
    }

    public Event withPayload(ObjectNode newPayload) {
        return toBuilder().payload(newPayload).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .eventId(eventId)
                .traceId(traceId)
                .spanId(spanId)
                .parentEventId(parentEventId)
                .type(type)
                .stage(stage)
                .source(source)
                .workerId(workerId)
                .timestamp(timestamp)
                .sequence(sequence)
                .status(status)
                .payload(payload)
                .evidenceRefs(evidenceRefs)
                .correlationId(correlationId)
                .causationId(causationId)
                .spanGenerated(spanGenerated)
                .ackOfEventId(ackOfEventId)
                .retryOfEventId(retryOfEventId);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    public static final class Builder {
        private String eventId;
        private String traceId;
        private String spanId;
        private String parentEventId;
        private String type;
        private Stage stage;
        private String source;
        private String workerId = "system";
        private long timestamp;
        private long sequence;
        private EventStatus status = EventStatus.OK;
        private ObjectNode payload;
        private List<EvidenceRef> evidenceRefs = List.of();
        private String correlationId;
        private String causationId;
        private boolean spanGenerated;
        private String ackOfEventId;
        private String retryOfEventId;

        private Builder() {}

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentEventId(String parentEventId) {
            this.parentEventId = parentEventId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder status(EventStatus status) {
            this.status = status;
            return this;
        }

        public Builder payload(ObjectNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder evidenceRefs(List<EvidenceRef> evidenceRefs) {
            this.evidenceRefs = evidenceRefs;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder spanGenerated(boolean spanGenerated) {
            this.spanGenerated = spanGenerated;
            return this;
        }

        public Builder ackOfEventId(String ackOfEventId) {
            this.ackOfEventId = ackOfEventId;
            return this;
        }

        public Builder retryOfEventId(String retryOfEventId) {
            this.retryOfEventId = retryOfEventId;
            return this;
        }

        public Event build() {
            return new Event(eventId, traceId, spanId, parentEventId, type, stage, source, workerId,
                    timestamp, sequence, status, payload, evidenceRefs, correlationId, causationId,
                    spanGenerated, ackOfEventId, retryOfEventId);
        }
    }
}
