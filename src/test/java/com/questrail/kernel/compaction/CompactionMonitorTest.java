package com.questrail.kernel.compaction;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.RecordingEventSink;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.SourceSequencer;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.CompactionTransitionEvent;
import com.questrail.kernel.observability.RecordingObservabilitySink;
import com.questrail.kernel.time.ManualMonotonicClock;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * CompactionMonitorTest
 * -----------------------------------------------------------------------------
 * Scores real output chunks against a manual clock and checks the published
 * episode.
 */
class CompactionMonitorTest {

    private static final String SUMMARY_CHUNK = "Compacting conversation...\n## Summary\n";

    private ManualMonotonicClock clock;
    private RecordingEventSink sink;
    private RecordingObservabilitySink obs;
    private List<String> gateCalls;
    private EventFactory producer;
    private CompactionMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        sink = new RecordingEventSink();
        obs = new RecordingObservabilitySink();
        gateCalls = new ArrayList<>();
        ManualWallClock wallClock = new ManualWallClock(1_700_000_000_000L);
        SourceSequencer sequencer = new SourceSequencer();
        producer = new EventFactory("producer.ui", wallClock, sequencer);
        monitor = new CompactionMonitor(sink,
                new EventFactory(CompactionMonitor.SOURCE, wallClock, sequencer),
                clock, CompactionThresholds.defaults(),
                (workerId, phase) -> gateCalls.add(workerId + ":" + phase + "@" + sink.all().size()),
                obs);
    }

    private void output(long afterMs, String chunk) {
        clock.advanceMillis(afterMs);
        monitor.onOutput("w1", chunk);
    }

    private void confirm() {
        output(0, SUMMARY_CHUNK);
        output(300, SUMMARY_CHUNK);
        output(800, SUMMARY_CHUNK);
        output(800, SUMMARY_CHUNK);
    }

    @Test
    void episodeIsPublishedAsOneChainedTrace() {
        confirm();
        output(600, "\n> ");
        clock.advanceMillis(1_500);
        monitor.tick();

        assertEquals(List.of(EventTypes.COMPACTION_SUSPECTED, EventTypes.COMPACTION_STARTED,
                EventTypes.COMPACTION_ENDED, EventTypes.COMPACTION_CLEARED), sink.types());

        List<Event> episode = sink.all();
        assertNull(episode.get(0).parentEventId());
        for (int i = 1; i < episode.size(); i++) {
            assertEquals(episode.get(0).traceId(), episode.get(i).traceId());
            assertEquals(episode.get(i - 1).eventId(), episode.get(i).parentEventId());
            assertEquals(Stage.TERMINAL, episode.get(i).stage());
        }

        Event started = episode.get(1);
        assertEquals("confirmed", started.payload().get("phase").asText());
        assertEquals("suspected", started.payload().get("fromPhase").asText());
        assertEquals(CompactionMonitor.DETECTOR_VERSION, started.payload().get("detectorVersion").asInt());
        assertTrue(started.payload().get("signals").size() >= 2);

        Event ended = episode.get(2);
        assertEquals("prompt_ready", ended.payload().get("reason").asText());
        assertEquals(600, ended.payload().get("durationMs").asLong());
        assertEquals(CompactionPhase.NONE, monitor.phase("w1"));
    }

    @Test
    void gateHearsEachPhaseBeforeItsEventIsEmitted() {
        confirm();

        assertEquals(List.of("w1:SUSPECTED@0", "w1:CONFIRMED@1"), gateCalls);
        assertEquals(2, obs.eventsOfType(CompactionTransitionEvent.class).size());
    }

    @Test
    void nextEpisodeGetsAFreshTrace() {
        confirm();
        output(600, "\n> ");
        clock.advanceMillis(1_500);
        monitor.tick();
        String first = sink.all().get(0).traceId();
        sink.clear();

        confirm();

        assertTrue(sink.all().stream().noneMatch(e -> e.traceId().equals(first)));
    }

    @Test
    void restartDuringCompactionClearsTheEpisode() {
        confirm();
        assertEquals(CompactionPhase.CONFIRMED, monitor.phase("w1"));

        monitor.onEvent(producer.builder(EventTypes.WORKER_RESTARTED, Stage.SYSTEM, TraceContext.origin("w1")).build());

        Event cleared = sink.last();
        assertEquals(EventTypes.COMPACTION_CLEARED, cleared.type());
        assertEquals("worker_restarted", cleared.payload().get("reason").asText());
        assertEquals(CompactionPhase.NONE, monitor.phase("w1"));
    }

    @Test
    void lexicalOutputAloneAfterAnInjectionStaysQuiet() {
        monitor.onEvent(producer.builder(EventTypes.INJECT_REQUESTED, Stage.ROUTE, TraceContext.origin("w1")).build());
        for (int i = 0; i < 3; i++) {
            output(200, "Compacting the cache directory");
        }
        assertEquals(CompactionPhase.NONE, monitor.phase("w1"));
        assertTrue(sink.all().isEmpty());
    }
}
