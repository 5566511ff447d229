package com.questrail.kernel.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EnvelopeNormalizer;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.SamplingPolicy;
import com.questrail.kernel.ingest.SourceSequencer;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.ingest.TraceRootRegistry;
import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.RecordingObservabilitySink;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * LedgerWriterTest
 * -----------------------------------------------------------------------------
 * The writer is driven with {@link LedgerWriter#drain()} so every assertion runs
 * on the test thread. One test starts the real writer thread.
 */
class LedgerWriterTest {

    private ManualWallClock wallClock;
    private InMemoryEventStore store;
    private EventFactory producer;
    private RecordingObservabilitySink obs;
    private List<Event> committed;

    @BeforeEach
    void setUp() {
        wallClock = new ManualWallClock(1_700_000_000_000L);
        store = new InMemoryEventStore();
        SourceSequencer sequencer = new SourceSequencer();
        producer = new EventFactory("producer", wallClock, sequencer);
        obs = new RecordingObservabilitySink();
        committed = new ArrayList<>();
    }

    private LedgerWriter writer(int capacity) {
        SourceSequencer sequencer = new SourceSequencer();
        EnvelopeNormalizer normalizer = new EnvelopeNormalizer(
                wallClock, sequencer, new TraceRootRegistry(100), SamplingPolicy.defaults());
        LedgerWriter w = new LedgerWriter(normalizer, store, capacity,
                new EventFactory(LedgerWriter.SOURCE, wallClock, sequencer), obs);
        w.addListener(committed::add);
        return w;
    }

    private Event event(String type, Stage stage) {
        return producer.builder(type, stage, TraceContext.origin("w1")).build();
    }

    @Test
    void commitsInSubmissionOrderAndNotifiesListeners() {
        LedgerWriter w = writer(10);
        Event a = event("inject.requested", Stage.INJECT);
        Event b = event("inject.applied", Stage.INJECT);

        w.submit(a);
        w.submit(b);
        assertEquals(0, store.size());

        assertEquals(2, w.drain());
        assertEquals(List.of(a.eventId(), b.eventId()), ids(committed));
        assertEquals(2, store.size());
    }

    @Test
    void invalidRawRecordBecomesDiagnostic() {
        LedgerWriter w = writer(10);
        ObjectNode raw = EventJson.objectNode();
        raw.put("type", "inject.requested");

        w.submitRaw(raw);
        w.drain();

        assertEquals(1, committed.size());
        assertEquals(EventTypes.EVENT_INVALID, committed.get(0).type());
    }

    @Test
    void eventRefusedByTheStoreLeavesADiagnostic() {
        LedgerWriter w = writer(10);
        Event a = event("inject.requested", Stage.INJECT);
        Event selfParented = a.toBuilder().parentEventId(a.eventId()).build();

        w.submit(selfParented);
        w.drain();

        assertEquals(1, store.status().invalidCount());
        assertEquals(1, committed.size());
        Event diagnostic = committed.get(0);
        assertEquals(EventTypes.EVENT_INVALID, diagnostic.type());
        assertEquals(LedgerWriter.SOURCE, diagnostic.source());
        assertEquals(a.eventId(), diagnostic.payload().get("rawEventId").asText());
        assertEquals("event is its own parent", diagnostic.payload().get("errors").get(0).asText());
        assertNotNull(store.findById(diagnostic.eventId()).orElse(null));
    }

    @Test
    void duplicateIsNotPublishedTwice() {
        LedgerWriter w = writer(10);
        Event a = event("inject.requested", Stage.INJECT);

        w.submit(a);
        w.submit(a);
        w.drain();

        assertEquals(1, committed.size());
        assertEquals(1, store.status().duplicateCount());
    }

    @Test
    void overflowEvictsTelemetryAndSummarizesDrops() {
        LedgerWriter w = writer(2);
        Event out1 = event(EventTypes.TERMINAL_OUTPUT, Stage.TERMINAL);
        Event out2 = event(EventTypes.TERMINAL_OUTPUT, Stage.TERMINAL);
        Event inject = event("inject.requested", Stage.INJECT);
        Event deferred = event(EventTypes.INJECT_DEFERRED, Stage.INJECT);

        w.submit(out1);
        w.submit(out2);
        w.submit(inject);
        w.submit(deferred);

        assertEquals(2, w.queueDepth());
        assertEquals(2, w.droppedTotal());

        w.drain();

        List<String> types = committed.stream().map(Event::type).collect(Collectors.toList());
        assertEquals(List.of(EventTypes.EVENT_DROPPED, "inject.requested", EventTypes.INJECT_DEFERRED), types);
        Event summary = committed.get(0);
        assertEquals(2, summary.payload().get("droppedCount").asInt());
        assertEquals(2, summary.payload().get("types").get(EventTypes.TERMINAL_OUTPUT).asInt());
    }

    @Test
    void contractEventsAreAdmittedPastCapacity() {
        LedgerWriter w = writer(1);
        w.submit(event("inject.requested", Stage.INJECT));
        w.submit(event(EventTypes.INJECT_DEFERRED, Stage.INJECT));
        w.submit(event(EventTypes.INJECT_DROPPED, Stage.INJECT));

        assertEquals(3, w.queueDepth());
        assertEquals(0, w.droppedTotal());
    }

    @Test
    void failingListenerDoesNotStopTheOthers() {
        LedgerWriter w = writer(10);
        w.addListener(e -> {
            throw new IllegalStateException("boom");
        });
        List<Event> second = new ArrayList<>();
        w.addListener(second::add);

        w.submit(event("inject.requested", Stage.INJECT));
        w.drain();

        assertEquals(1, second.size());
        assertTrue(obs.hasEventOfType(KernelErrorEvent.class));
    }

    @Test
    void writerThreadCommitsSubmittedEvents() throws InterruptedException {
        LedgerWriter w = writer(100);
        CountDownLatch latch = new CountDownLatch(3);
        w.addListener(e -> latch.countDown());
        w.start();
        try {
            w.submit(event("inject.requested", Stage.INJECT));
            w.submit(event("inject.applied", Stage.INJECT));
            w.submit(event("inject.verified", Stage.VERIFY));
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            w.stop();
        }
        assertEquals(3, store.size());
    }

    @Test
    void interruptedWriterThreadKeepsCommitting() throws InterruptedException {
        LedgerWriter w = writer(100);
        AtomicReference<Thread> writerThread = new AtomicReference<>();
        CountDownLatch first = new CountDownLatch(1);
        CountDownLatch all = new CountDownLatch(3);
        w.addListener(e -> {
            writerThread.compareAndSet(null, Thread.currentThread());
            first.countDown();
            all.countDown();
        });
        w.start();
        try {
            w.submit(event("inject.requested", Stage.INJECT));
            assertTrue(first.await(5, TimeUnit.SECONDS));

            writerThread.get().interrupt();
            w.submit(event("inject.applied", Stage.INJECT));
            w.submit(event("inject.verified", Stage.VERIFY));

            assertTrue(all.await(5, TimeUnit.SECONDS));
            assertTrue(writerThread.get().isAlive());
        } finally {
            w.stop();
        }
        assertEquals(3, store.size());
    }

    private static List<String> ids(List<Event> events) {
        return events.stream().map(Event::eventId).collect(Collectors.toList());
    }
}
