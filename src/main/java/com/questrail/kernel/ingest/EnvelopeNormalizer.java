package com.questrail.kernel.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventIds;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTaxonomy;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * EnvelopeNormalizer
 * =============================================================================
 * Turns raw records from heterogeneous producers into canonical {@link Event}s.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Required: {@code eventId, traceId, type, stage, source, timestamp}.</li>
 *   <li>Legacy aliases ({@code correlationId, causationId, paneId, ts, seq}) are
 *       copied into the canonical fields. {@code correlationId} and
 *       {@code causationId} are kept as mirrors. A canonical field and its alias
 *       that disagree are an unresolvable conflict.</li>
 *   <li>A missing {@code spanId} is derived from the hop and flagged with
 *       {@code spanGenerated}.</li>
 *   <li>A trace id is minted only for records marked {@code "origin": true}.</li>
 *   <li>A second parentless ingress event for an already rooted trace is kept
 *       as sent and diagnosed with {@code trace.root.duplicate}.</li>
 * </ul>
 *
 * <h2>Failure</h2>
 * A record that cannot be normalized yields a {@code event.invalid} diagnostic
 * instead of an exception. The producer is never blocked or failed.
 */
public final class EnvelopeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeNormalizer.class);

    static final String SOURCE = "kernel.normalizer";

    private final WallClock wallClock;
    private final SourceSequencer sequencer;
    private final TraceRootRegistry roots;
    private final SamplingPolicy sampling;

    public EnvelopeNormalizer(WallClock wallClock,
                              SourceSequencer sequencer,
                              TraceRootRegistry roots,
                              SamplingPolicy sampling)
    {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.roots = Objects.requireNonNull(roots, "roots");
        this.sampling = Objects.requireNonNull(sampling, "sampling");
    }

    /**
     * Normalize a raw record.
     */
    public NormalizationResult normalize(JsonNode raw) {
        List<String> errors = new ArrayList<>();
        if (raw == null || !raw.isObject()) {
            errors.add("record must be a JSON object");
            return reject(raw, null, errors);
        }

        String traceId = aliased(raw, "traceId", "correlationId", errors);
        String parentEventId = aliased(raw, "parentEventId", "causationId", errors);
        String workerId = aliased(raw, "workerId", "paneId", errors);
        int errorsBeforeTimestamp = errors.size();
        Long timestamp = aliasedLong(raw, "timestamp", "ts", errors);
        boolean timestampUnreadable = errors.size() > errorsBeforeTimestamp;
        Long sequence = aliasedLong(raw, "sequence", "seq", errors);

        String eventId = EventJson.text(raw, "eventId");
        String type = EventJson.text(raw, "type");
        String stageText = EventJson.text(raw, "stage");
        String source = EventJson.text(raw, "source");

        if (traceId == null && raw.path("origin").asBoolean(false)) {
            traceId = EventIds.newTraceId();
        }

        requirePresent(eventId, "eventId", errors);
        requirePresent(traceId, "traceId", errors);
        requirePresent(type, "type", errors);
        requirePresent(stageText, "stage", errors);
        requirePresent(source, "source", errors);
        if (timestamp == null && !timestampUnreadable) {
            errors.add("missing required field: timestamp");
        }
        if (type != null && !EventTaxonomy.isWellFormed(type)) {
            errors.add("malformed type: " + type);
        }

        Stage stage = null;
        if (stageText != null) {
            stage = Stage.fromWire(stageText).orElse(null);
            if (stage == null) {
                errors.add("unknown stage: " + stageText);
            }
        }

        EventStatus status = EventStatus.OK;
        String statusText = EventJson.text(raw, "status");
        if (statusText != null) {
            Optional<EventStatus> parsed = EventStatus.fromWire(statusText);
            if (parsed.isEmpty()) {
                errors.add("unknown status: " + statusText);
            } else {
                status = parsed.get();
            }
        }

        if (!errors.isEmpty()) {
            return reject(raw, traceId, errors);
        }

        if (workerId == null) {
            workerId = "system";
        }
        if (sequence == null) {
            sequence = sequencer.next(source);
        } else {
            sequencer.observe(source, sequence);
        }

        String spanId = EventJson.text(raw, "spanId");
        boolean spanGenerated = false;
        if (spanId == null) {
            spanId = EventIds.derivedSpanId(traceId, stage, source, workerId);
            spanGenerated = true;
        }

        JsonNode meta = raw.path("meta");
        Event event = Event.builder()
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
                .payload(payloadOf(raw.get("payload")))
                .evidenceRefs(EventJson.evidenceFromJson(raw.get("evidenceRefs")))
                .correlationId(EventJson.text(raw, "correlationId"))
                .causationId(EventJson.text(raw, "causationId"))
                .spanGenerated(spanGenerated)
                .ackOfEventId(firstText(raw, meta, "ackOfEventId"))
                .retryOfEventId(firstText(raw, meta, "retryOfEventId"))
                .build();

        return admit(event);
    }

    /**
     * Admit an event that is already canonical (produced in-process): applies
     * sampling and the trace-root check.
     */
    public NormalizationResult admit(Event event) {
        Objects.requireNonNull(event, "event");
        Event sampled = sampling.apply(event);

        List<Event> diagnostics = new ArrayList<>(1);
        if (!sampled.hasParent() && sampled.stage() == Stage.INGRESS) {
            roots.claim(sampled.traceId(), sampled.eventId())
                    .ifPresent(existing -> diagnostics.add(duplicateRoot(sampled, existing)));
        }
        return new NormalizationResult.Accepted(sampled, diagnostics);
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    private Event duplicateRoot(Event duplicate, String existingRootId) {
        log.warn("Trace {} already rooted by {}; {} is a second root",
                duplicate.traceId(), existingRootId, duplicate.eventId());

        ObjectNode payload = EventJson.objectNode();
        payload.put("existingRootEventId", existingRootId);
        payload.put("duplicateEventId", duplicate.eventId());
        payload.put("duplicateSource", duplicate.source());

        return Event.builder()
                .eventId(EventIds.newEventId())
                .traceId(duplicate.traceId())
                .parentEventId(duplicate.eventId())
                .spanId(EventIds.newSpanId())
                .type(EventTypes.TRACE_ROOT_DUPLICATE)
                .stage(Stage.SYSTEM)
                .source(SOURCE)
                .workerId(duplicate.workerId())
                .timestamp(wallClock.nowMillis())
                .sequence(sequencer.next(SOURCE))
                .status(EventStatus.FAILED)
                .payload(payload)
                .build();
    }

    private NormalizationResult reject(JsonNode raw, String traceId, List<String> errors) {
        log.debug("Rejected record: {}", errors);

        ObjectNode payload = EventJson.objectNode();
        ArrayNode errs = payload.putArray("errors");
        errors.forEach(errs::add);
        String rawEventId = EventJson.text(raw, "eventId");
        String rawType = EventJson.text(raw, "type");
        String rawSource = EventJson.text(raw, "source");
        if (rawEventId != null) {
            payload.put("rawEventId", rawEventId);
        }
        if (rawType != null) {
            payload.put("rawType", rawType);
        }
        if (rawSource != null) {
            payload.put("rawSource", rawSource);
        }

        Event diagnostic = Event.builder()
                .eventId(EventIds.newEventId())
                .traceId(traceId != null ? traceId : EventIds.newTraceId())
                .spanId(EventIds.newSpanId())
                .type(EventTypes.EVENT_INVALID)
                .stage(Stage.SYSTEM)
                .source(SOURCE)
                .workerId("system")
                .timestamp(wallClock.nowMillis())
                .sequence(sequencer.next(SOURCE))
                .status(EventStatus.FAILED)
                .payload(payload)
                .build();
        return new NormalizationResult.Rejected(diagnostic, errors);
    }

    // ---------------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------------

    private static String aliased(JsonNode raw, String canonical, String legacy, List<String> errors) {
        String a = EventJson.text(raw, canonical);
        String b = EventJson.text(raw, legacy);
        if (a != null && b != null && !a.equals(b)) {
            errors.add("field conflict: " + canonical + "=" + a + " but " + legacy + "=" + b);
            return null;
        }
        return a != null ? a : b;
    }

    private static Long aliasedLong(JsonNode raw, String canonical, String legacy, List<String> errors) {
        Long a = longValue(raw, canonical, errors);
        Long b = longValue(raw, legacy, errors);
        if (a != null && b != null && !a.equals(b)) {
            errors.add("field conflict: " + canonical + "=" + a + " but " + legacy + "=" + b);
            return null;
        }
        return a != null ? a : b;
    }

    /**
     * Accepts integral numbers, numeric strings and ISO-8601 instants.
     */
    private static Long longValue(JsonNode raw, String field, List<String> errors) {
        JsonNode v = raw.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isIntegralNumber()) {
            return v.longValue();
        }
        if (v.isNumber()) {
            return (long) v.doubleValue();
        }
        if (v.isTextual()) {
            String s = v.textValue().trim();
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException notNumeric) {
                try {
                    return Instant.parse(s).toEpochMilli();
                } catch (DateTimeParseException notInstant) {
                    errors.add("unparseable " + field + ": " + s);
                    return null;
                }
            }
        }
        errors.add("unparseable " + field + ": " + v);
        return null;
    }

    private static void requirePresent(String value, String field, List<String> errors) {
        if (value == null) {
            errors.add("missing required field: " + field);
        }
    }

    private static String firstText(JsonNode raw, JsonNode meta, String field) {
        String direct = EventJson.text(raw, field);
        return direct != null ? direct : EventJson.text(meta, field);
    }

    private static ObjectNode payloadOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EventJson.objectNode();
        }
        if (node instanceof ObjectNode obj) {
            return obj;
        }
        ObjectNode wrapped = EventJson.objectNode();
        wrapped.set("value", node);
        return wrapped;
    }
}
