package com.questrail.kernel.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.store.EventFilter;
import com.questrail.kernel.store.InMemoryEventStore;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * TraceQueryEngineTest
 * -----------------------------------------------------------------------------
 * Trace views, journeys and failure paths over a small in-memory ledger.
 */
class TraceQueryEngineTest {

    private static final long T0 = 1_700_000_000_000L;

    private InMemoryEventStore store;
    private ManualWallClock wallClock;
    private TraceQueryEngine queries;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        wallClock = new ManualWallClock(T0 + 1_000);
        queries = new TraceQueryEngine(store, wallClock, Duration.ofSeconds(60));
    }

    private static Event.Builder event(String id, String trace, String parent, String type, Stage stage, long ts) {
        return Event.builder()
                .eventId(id)
                .traceId(trace)
                .spanId("s-" + trace + "-" + stage.wireName())
                .parentEventId(parent)
                .type(type)
                .stage(stage)
                .source(stage.wireName() + ".svc")
                .workerId("w1")
                .timestamp(ts);
    }

    private void cleanTrace(String trace) {
        store.append(event(trace + "-1", trace, null, "ingress.received", Stage.INGRESS, T0).build());
        store.append(event(trace + "-2", trace, trace + "-1", "route.selected", Stage.ROUTE, T0 + 10).build());
        store.append(event(trace + "-3", trace, trace + "-2", "inject.requested", Stage.INJECT, T0 + 25).build());
        store.append(event(trace + "-4", trace, trace + "-3", "inject.verified", Stage.VERIFY, T0 + 60).build());
    }

    @Test
    void traceViewOrdersCausallyAndCountsStages() {
        // Route arrives first and carries a skewed timestamp.
        store.append(event("r", "t1", "i", "route.selected", Stage.ROUTE, T0 - 5_000).build());
        store.append(event("i", "t1", null, "ingress.received", Stage.INGRESS, T0).build());

        TraceView view = queries.queryTrace("t1");

        assertEquals(List.of("i", "r"), view.events().stream().map(Event::eventId).collect(Collectors.toList()));
        assertEquals(1, view.countFor(Stage.INGRESS));
        assertEquals(0, view.countFor(Stage.VERIFY));
        HopLatency first = view.hops().get(0);
        assertEquals(-5_000L, first.deltaMs());
        assertTrue(first.skewed());
        assertFalse(view.hops().get(1).observed());
        assertEquals(1, view.edges().size());
        assertFalse(view.truncated());
    }

    @Test
    void unknownTraceIsEmpty() {
        assertTrue(queries.queryTrace("nope").isEmpty());
    }

    @Test
    void openSpanPastTimeoutIsFlaggedButNotClosed() {
        store.append(event("d", "t1", null, EventTypes.INJECT_DEFERRED, Stage.INJECT, T0)
                .status(EventStatus.DEFERRED).build());

        assertTrue(queries.queryTrace("t1").leakedSpans().isEmpty());

        wallClock.advanceMillis(61_000);
        TraceView view = queries.queryTrace("t1");
        assertEquals(1, view.leakedSpans().size());
        assertTrue(store.spansForTrace("t1").get(0).isOpen());
    }

    @Test
    void journeyMarksSeenInferredAndMissingStages() {
        cleanTrace("t1");

        JourneyView journey = queries.queryJourney("t1");

        assertEquals(JourneyState.SEEN, journey.step(Stage.INGRESS).state());
        assertEquals(10L, journey.step(Stage.ROUTE).deltaFromPreviousMs());
        assertEquals(JourneyState.INFERRED, journey.step(Stage.TRANSPORT).state());
        assertEquals(JourneyState.INFERRED, journey.step(Stage.ACK).state());
        assertEquals(35L, journey.step(Stage.VERIFY).deltaFromPreviousMs());
        assertTrue(journey.complete());
    }

    @Test
    void journeyOfStalledTraceEndsInMissingStages() {
        store.append(event("a", "t2", null, "ingress.received", Stage.INGRESS, T0).build());
        store.append(event("b", "t2", "a", "inject.failed", Stage.INJECT, T0 + 5)
                .status(EventStatus.FAILED).build());

        JourneyView journey = queries.queryJourney("t2");

        assertEquals(JourneyState.INFERRED, journey.step(Stage.ROUTE).state());
        assertEquals(JourneyState.FAILED, journey.step(Stage.INJECT).state());
        assertEquals(JourneyState.MISSING, journey.step(Stage.VERIFY).state());
        assertNull(journey.step(Stage.VERIFY).eventId());
        assertFalse(journey.complete());
    }

    @Test
    void failurePathStartsAtCausallyEarliestFailure() {
        store.append(event("a", "t3", null, "ingress.received", Stage.INGRESS, T0).build());
        ObjectNode p = EventJson.objectNode();
        p.put("kind", "ownership_conflict");
        store.append(event("v", "t3", "a", EventTypes.CONTRACT_VIOLATION, Stage.INJECT, T0 + 5)
                .status(EventStatus.FAILED).payload(p).build());
        store.append(event("f", "t3", "v", "inject.failed", Stage.INJECT, T0 + 6)
                .status(EventStatus.FAILED).build());

        List<FailurePath> paths = queries.queryFailurePath(FailureQuery.forTrace("t3"));

        assertEquals(1, paths.size());
        FailurePath path = paths.get(0);
        assertEquals("v", path.failingEvent().eventId());
        assertEquals(FailureClass.OWNERSHIP_CONFLICT, path.failureClass());
        assertEquals(List.of("f"), path.downstream().stream().map(Event::eventId).collect(Collectors.toList()));
    }

    @Test
    void resumedDeferralIsNotAFailure() {
        store.append(event("d", "t4", null, EventTypes.INJECT_DEFERRED, Stage.INJECT, T0)
                .status(EventStatus.DEFERRED).build());
        store.append(event("r", "t4", "d", EventTypes.INJECT_RESUMED, Stage.INJECT, T0 + 100).build());

        assertTrue(queries.queryFailurePath(FailureQuery.forTrace("t4")).isEmpty());
    }

    @Test
    void unresumedDeferralIsAFailure() {
        ObjectNode p = EventJson.objectNode();
        p.putArray("reasons").add("focus_lock");
        store.append(event("d", "t5", null, EventTypes.INJECT_DEFERRED, Stage.INJECT, T0)
                .status(EventStatus.DEFERRED).payload(p).build());

        List<FailurePath> paths = queries.queryFailurePath(FailureQuery.forTrace("t5"));

        assertEquals(1, paths.size());
        assertEquals(FailureClass.FOCUS_LOCK, paths.get(0).failureClass());
    }

    @Test
    void failureSearchScansRecentTracesAndFiltersByClass() {
        cleanTrace("ok");
        ObjectNode gate = EventJson.objectNode();
        gate.put("reason", "compaction_gate");
        store.append(event("g", "gated", null, EventTypes.INJECT_DROPPED, Stage.INJECT, T0 + 1)
                .status(EventStatus.DROPPED).payload(gate).build());
        store.append(event("x", "timeout", null, EventTypes.COMMAND_ACK_TIMEOUT, Stage.ACK, T0 + 2)
                .status(EventStatus.TIMEOUT).build());

        List<FailurePath> all = queries.queryFailurePath(FailureQuery.builder().build());
        assertEquals(2, all.size());

        List<FailurePath> gated = queries.queryFailurePath(
                FailureQuery.builder().withFailureClass(FailureClass.COMPACTION_GATE).build());
        assertEquals(1, gated.size());
        assertEquals("gated", gated.get(0).traceId());
    }

    @Test
    void eventQueryDelegatesToTheStore() {
        cleanTrace("t6");
        assertEquals(4, queries.queryEvents(EventFilter.builder().withTraceId("t6").build()).size());
    }
}
