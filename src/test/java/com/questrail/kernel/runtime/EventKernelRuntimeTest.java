package com.questrail.kernel.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.bridge.BridgeLink;
import com.questrail.kernel.bridge.Direction;
import com.questrail.kernel.bridge.EnvelopeCodec;
import com.questrail.kernel.bridge.FakeDatagramEndpoint;
import com.questrail.kernel.bridge.TransportEnvelope;
import com.questrail.kernel.config.KernelConfig;
import com.questrail.kernel.contract.Decision;
import com.questrail.kernel.contract.InjectionRequest;
import com.questrail.kernel.contract.LinkState;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.RecordingObservabilitySink;
import com.questrail.kernel.query.FailureClass;
import com.questrail.kernel.query.FailurePath;
import com.questrail.kernel.query.FailureQuery;
import com.questrail.kernel.query.JourneyState;
import com.questrail.kernel.query.JourneyView;
import com.questrail.kernel.query.TraceView;
import com.questrail.kernel.store.EventFilter;
import com.questrail.kernel.time.DeterministicScheduler;
import com.questrail.kernel.time.ManualMonotonicClock;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * EventKernelRuntimeTest
 * -----------------------------------------------------------------------------
 * End-to-end scenarios through the composed kernel: producers write, the
 * contract engine reacts to committed events, and every outcome is answerable
 * from the query API.
 *
 * <p>The writer is drained by hand and time only moves when a test moves it.</p>
 */
class EventKernelRuntimeTest {

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink obs;
    private EventKernelRuntime kernel;
    private EventFactory ui;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock(1_700_000_000_000L);
        scheduler = new DeterministicScheduler(clock);
        obs = new RecordingObservabilitySink();
        kernel = EventKernelRuntime.builder()
                .withConfig(KernelConfig.builder().withStoreDurable(false).build())
                .withClock(clock)
                .withWallClock(wallClock)
                .withScheduler(scheduler)
                .withObservabilitySink(obs)
                .withManualDrain(true)
                .build();
        kernel.start();
        ui = kernel.factory("producer.ui");
    }

    @AfterEach
    void tearDown() {
        kernel.stop();
    }

    private void advance(long millis) {
        clock.advanceMillis(millis);
        wallClock.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    private String traceOf(String type) {
        List<Event> found = kernel.queries().queryEvents(EventFilter.builder().withType(type).build());
        assertEquals(1, found.size(), "expected exactly one " + type);
        return found.get(0).traceId();
    }

    private static List<String> types(TraceView view) {
        return view.events().stream().map(Event::type).collect(Collectors.toList());
    }

    @Test
    void cleanInjectionIsAnsweredAsACompleteJourney() {
        InjectionRequest req = InjectionRequest.inject("w1", null);
        assertEquals(Decision.ALLOW, kernel.submit(req).decision());
        kernel.drain();
        advance(40);
        kernel.contracts().recordSubmitSent(req.requestId());
        advance(40);
        kernel.contracts().recordVerified(req.requestId());
        kernel.drain();

        String traceId = traceOf(EventTypes.INJECT_REQUESTED);
        TraceView view = kernel.queries().queryTrace(traceId);

        assertEquals(List.of(EventTypes.INJECT_REQUESTED, EventTypes.INJECT_APPLIED,
                EventTypes.INJECT_SUBMIT_SENT, EventTypes.INJECT_VERIFIED), types(view));
        assertTrue(view.orphans().isEmpty());
        assertFalse(view.cyclic());

        JourneyView journey = kernel.queries().queryJourney(traceId);
        assertTrue(journey.complete());
        assertEquals(JourneyState.SEEN, journey.step(Stage.TRANSPORT).state());
        assertTrue(kernel.queries().queryFailurePath(FailureQuery.forTrace(traceId)).isEmpty());
    }

    @Test
    void focusLockedInjectionThatExpiresIsExplainedAsFocusLock() {
        kernel.emit(ui.builder(EventTypes.PANE_FOCUS_LOCKED, Stage.SYSTEM, TraceContext.origin("w1")).build());
        kernel.drain();

        assertEquals(Decision.DEFER, kernel.submit(InjectionRequest.inject("w1", null)).decision());
        kernel.drain();
        advance(30_000);
        kernel.drain();

        String traceId = traceOf(EventTypes.INJECT_REQUESTED);
        assertEquals(List.of(EventTypes.INJECT_REQUESTED, EventTypes.INJECT_DEFERRED, EventTypes.INJECT_DROPPED),
                types(kernel.queries().queryTrace(traceId)));

        List<FailurePath> paths = kernel.queries().queryFailurePath(FailureQuery.forTrace(traceId));
        assertEquals(1, paths.size());
        assertEquals(EventTypes.INJECT_DROPPED, paths.get(0).failingEvent().type());
        assertEquals(FailureClass.FOCUS_LOCK, paths.get(0).failureClass());
    }

    @Test
    void releasedFocusResumesTheDeferredRequestInItsOwnTrace() {
        kernel.emit(ui.builder(EventTypes.PANE_FOCUS_LOCKED, Stage.SYSTEM, TraceContext.origin("w1")).build());
        kernel.drain();
        kernel.submit(InjectionRequest.inject("w1", null));
        kernel.drain();

        advance(1_000);
        kernel.emit(ui.builder(EventTypes.PANE_FOCUS_RELEASED, Stage.SYSTEM, TraceContext.origin("w1")).build());
        kernel.drain();

        String traceId = traceOf(EventTypes.INJECT_REQUESTED);
        assertEquals(List.of(EventTypes.INJECT_REQUESTED, EventTypes.INJECT_DEFERRED,
                EventTypes.INJECT_RESUMED, EventTypes.INJECT_APPLIED), types(kernel.queries().queryTrace(traceId)));
    }

    @Test
    void bridgeLossIsRecordedAndReachesTheContractEngine() {
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
        InetSocketAddress peer = new InetSocketAddress("127.0.0.1", 47001);
        kernel.submit(InjectionRequest.inject("w1", null));
        BridgeLink link = kernel.openBridge(endpoint, peer, Direction.KERNEL_TO_PRODUCER);
        kernel.drain();
        assertTrue(link.isUp());

        endpoint.simulateDown(null);
        kernel.drain();

        assertEquals(LinkState.DOWN, kernel.contracts().state("w1").bridge());
        List<Event> lifecycle = kernel.queries().queryEvents(EventFilter.builder().withType("bridge.*").build());
        assertEquals(List.of(EventTypes.BRIDGE_CONNECTED, EventTypes.BRIDGE_DISCONNECTED),
                lifecycle.stream().map(Event::type).collect(Collectors.toList()));

        assertFalse(link.forward(ui.builder(EventTypes.INJECT_REQUESTED, Stage.ROUTE, TraceContext.origin("w1")).build()));
        endpoint.simulateUp();
        link.forward(ui.builder(EventTypes.INJECT_REQUESTED, Stage.ROUTE, TraceContext.origin("w1")).build());

        List<TransportEnvelope> sent = endpoint.sentEnvelopes();
        TransportEnvelope summary = sent.get(sent.size() - 2);
        assertEquals(EventTypes.EVENT_DROPPED, summary.event().get("type").asText());
        assertEquals("link_down", summary.event().get("payload").get("reason").asText());

        kernel.drain();
        List<String> local = kernel.queries().queryEvents(EventFilter.builder().build()).stream()
                .map(Event::type)
                .filter(t -> t.startsWith("bridge.") || t.equals(EventTypes.EVENT_DROPPED))
                .collect(Collectors.toList());
        assertEquals(List.of(EventTypes.BRIDGE_CONNECTED, EventTypes.BRIDGE_DISCONNECTED,
                EventTypes.BRIDGE_CONNECTED, EventTypes.EVENT_DROPPED), local);
        Event dropped = kernel.queries().queryEvents(EventFilter.builder().withType(EventTypes.EVENT_DROPPED).build()).get(0);
        assertEquals(1, dropped.payload().get("droppedCount").asLong());
    }

    @Test
    void inboundBridgeRecordsAreNormalizedIntoTheLedger() {
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
        InetSocketAddress peer = new InetSocketAddress("127.0.0.1", 47001);
        kernel.openBridge(endpoint, peer, Direction.PRODUCER_TO_KERNEL);

        ObjectNode raw = EventJson.objectNode();
        raw.put("eventId", "remote-1");
        raw.put("traceId", "remote-trace");
        raw.put("type", EventTypes.INJECT_REQUESTED);
        raw.put("stage", "route");
        raw.put("source", "producer.remote");
        raw.put("workerId", "w9");
        raw.put("timestamp", wallClock.nowMillis());
        endpoint.injectDatagram(peer, EnvelopeCodec.encode(
                TransportEnvelope.of(1, wallClock.nowMillis(), Direction.PRODUCER_TO_KERNEL, raw)));
        kernel.drain();

        TraceView view = kernel.queries().queryTrace("remote-trace");
        assertEquals(1, view.events().size());
        assertEquals("producer.remote", view.events().get(0).source());
    }

    @Test
    void terminalOutputIsRecordedAsMetadataOnly() {
        kernel.onTerminalOutput("w1", "secret build output");
        kernel.drain();

        List<Event> out = kernel.queries().queryEvents(
                EventFilter.builder().withType(EventTypes.TERMINAL_OUTPUT).build());
        assertEquals(1, out.size());
        assertFalse(out.get(0).payload().has("chunk"));
        assertEquals("secret build output".length(), out.get(0).payload().get("byteLength").asInt());
    }

    @Test
    void stopCancelsPeriodicWork() {
        assertTrue(scheduler.pending() >= 3);
        kernel.stop();
        assertEquals(0, scheduler.pending());
    }
}
