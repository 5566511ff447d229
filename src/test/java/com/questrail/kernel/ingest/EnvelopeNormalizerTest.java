package com.questrail.kernel.ingest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * EnvelopeNormalizerTest
 * -----------------------------------------------------------------------------
 * Canonical fields, legacy aliases, generated spans and the two diagnostics the
 * normalizer can raise ({@code event.invalid}, {@code trace.root.duplicate}).
 */
class EnvelopeNormalizerTest {

    private ManualWallClock wallClock;
    private SourceSequencer sequencer;
    private EnvelopeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        wallClock = new ManualWallClock(1_700_000_000_000L);
        sequencer = new SourceSequencer();
        normalizer = new EnvelopeNormalizer(wallClock, sequencer, new TraceRootRegistry(100), SamplingPolicy.defaults());
    }

    private static ObjectNode record(String eventId, String traceId, String type, String stage) {
        ObjectNode n = EventJson.objectNode();
        n.put("eventId", eventId);
        if (traceId != null) {
            n.put("traceId", traceId);
        }
        n.put("type", type);
        n.put("stage", stage);
        n.put("source", "producer.a");
        n.put("timestamp", 1_700_000_000_500L);
        return n;
    }

    @Test
    void canonicalRecordIsAccepted() {
        ObjectNode raw = record("e1", "t1", "inject.requested", "inject");
        raw.put("workerId", "w1");
        raw.put("spanId", "s1");
        raw.put("status", "deferred");
        raw.putObject("payload").put("k", "v");

        NormalizationResult.Accepted ok = assertInstanceOf(NormalizationResult.Accepted.class, normalizer.normalize(raw));
        Event e = ok.event();

        assertEquals("e1", e.eventId());
        assertEquals("t1", e.traceId());
        assertEquals("s1", e.spanId());
        assertEquals(Stage.INJECT, e.stage());
        assertEquals(EventStatus.DEFERRED, e.status());
        assertEquals("w1", e.workerId());
        assertEquals("v", e.payload().get("k").asText());
        assertFalse(e.spanGenerated());
        assertEquals(1, e.sequence());
        assertTrue(ok.diagnostics().isEmpty());
    }

    @Test
    void legacyAliasesPopulateCanonicalFieldsAndAreMirrored() {
        ObjectNode raw = EventJson.objectNode();
        raw.put("eventId", "e2");
        raw.put("correlationId", "t-legacy");
        raw.put("causationId", "e1");
        raw.put("paneId", "pane-3");
        raw.put("ts", "2023-11-14T22:13:20Z");
        raw.put("seq", 41);
        raw.put("type", "inject.applied");
        raw.put("stage", "INJECT");
        raw.put("source", "legacy.router");

        Event e = ((NormalizationResult.Accepted) normalizer.normalize(raw)).event();

        assertEquals("t-legacy", e.traceId());
        assertEquals("e1", e.parentEventId());
        assertEquals("pane-3", e.workerId());
        assertEquals(1_700_000_000_000L, e.timestamp());
        assertEquals(41, e.sequence());
        assertEquals("t-legacy", e.correlationId());
        assertEquals("e1", e.causationId());
        assertEquals(41, sequencer.current("legacy.router"));
    }

    @Test
    void conflictingAliasIsRejected() {
        ObjectNode raw = record("e3", "t1", "inject.applied", "inject");
        raw.put("correlationId", "t2");

        NormalizationResult.Rejected rejected =
                assertInstanceOf(NormalizationResult.Rejected.class, normalizer.normalize(raw));

        assertEquals(EventTypes.EVENT_INVALID, rejected.diagnostic().type());
        assertEquals(EventStatus.FAILED, rejected.diagnostic().status());
        assertTrue(rejected.errors().get(0).startsWith("field conflict: traceId"));
        assertEquals("e3", rejected.diagnostic().payload().get("rawEventId").asText());
    }

    @Test
    void missingFieldsAreAllReported() {
        ObjectNode raw = EventJson.objectNode();
        raw.put("type", "inject.applied");

        NormalizationResult.Rejected rejected =
                assertInstanceOf(NormalizationResult.Rejected.class, normalizer.normalize(raw));

        assertTrue(rejected.errors().contains("missing required field: eventId"));
        assertTrue(rejected.errors().contains("missing required field: traceId"));
        assertTrue(rejected.errors().contains("missing required field: stage"));
        assertTrue(rejected.errors().contains("missing required field: source"));
        assertTrue(rejected.errors().contains("missing required field: timestamp"));
        assertEquals(5, rejected.diagnostic().payload().get("errors").size());
    }

    @Test
    void unknownStageAndMalformedTypeAreRejected() {
        NormalizationResult r = normalizer.normalize(record("e4", "t1", "Inject Requested", "warp"));

        NormalizationResult.Rejected rejected = assertInstanceOf(NormalizationResult.Rejected.class, r);
        assertTrue(rejected.errors().contains("malformed type: Inject Requested"));
        assertTrue(rejected.errors().contains("unknown stage: warp"));
    }

    @Test
    void nonObjectRecordIsRejected() {
        NormalizationResult r = normalizer.normalize(EventJson.MAPPER.createArrayNode());
        assertInstanceOf(NormalizationResult.Rejected.class, r);
    }

    @Test
    void missingSpanIsDerivedAndFlagged() {
        Event a = ((NormalizationResult.Accepted) normalizer.normalize(record("e5", "t1", "route.selected", "route"))).event();
        Event b = ((NormalizationResult.Accepted) normalizer.normalize(record("e6", "t1", "route.done", "route"))).event();

        assertTrue(a.spanGenerated());
        assertNotNull(a.spanId());
        assertEquals(a.spanId(), b.spanId());
    }

    @Test
    void traceIdIsMintedOnlyForOriginRecords() {
        ObjectNode origin = record("e7", null, "ingress.received", "ingress");
        origin.put("origin", true);
        ObjectNode notOrigin = record("e8", null, "ingress.received", "ingress");

        Event minted = ((NormalizationResult.Accepted) normalizer.normalize(origin)).event();
        assertNotNull(minted.traceId());
        assertNull(minted.parentEventId());

        assertInstanceOf(NormalizationResult.Rejected.class, normalizer.normalize(notOrigin));
    }

    @Test
    void secondIngressRootIsKeptAndDiagnosed() {
        normalizer.normalize(record("root-1", "t9", "ingress.received", "ingress"));
        NormalizationResult r = normalizer.normalize(record("root-2", "t9", "ingress.received", "ingress"));

        NormalizationResult.Accepted ok = assertInstanceOf(NormalizationResult.Accepted.class, r);
        assertEquals("root-2", ok.event().eventId());
        assertNull(ok.event().parentEventId());
        assertEquals(1, ok.diagnostics().size());

        Event diag = ok.diagnostics().get(0);
        assertEquals(EventTypes.TRACE_ROOT_DUPLICATE, diag.type());
        assertEquals("t9", diag.traceId());
        assertEquals("root-2", diag.parentEventId());
        assertEquals("root-1", diag.payload().get("existingRootEventId").asText());
        assertEquals(2, ok.toAppend().size());
    }

    @Test
    void explicitEdgeHintsAreReadFromMeta() {
        ObjectNode raw = record("e10", "t1", "command.ack", "ack");
        raw.putObject("meta").put("ackOfEventId", "cmd-1");
        raw.put("retryOfEventId", "e9");

        Event e = ((NormalizationResult.Accepted) normalizer.normalize(raw)).event();
        assertEquals("cmd-1", e.ackOfEventId());
        assertEquals("e9", e.retryOfEventId());
    }
}
