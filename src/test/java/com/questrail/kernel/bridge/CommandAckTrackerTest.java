package com.questrail.kernel.bridge;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.RecordingEventSink;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.SourceSequencer;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.time.DeterministicScheduler;
import com.questrail.kernel.time.ManualMonotonicClock;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandAckTrackerTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingEventSink sink;
    private EventFactory producer;
    private EventFactory kernel;
    private CommandAckTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingEventSink();
        ManualWallClock wallClock = new ManualWallClock(1_700_000_000_000L);
        SourceSequencer sequencer = new SourceSequencer();
        producer = new EventFactory("producer.ui", wallClock, sequencer);
        kernel = new EventFactory(BridgeLink.SOURCE, wallClock, sequencer);
        tracker = new CommandAckTracker(sink, kernel, clock, scheduler, Duration.ofSeconds(5));
    }

    private Event command() {
        return CommandAcks.command(producer, TraceContext.origin("w1"), "restart", null);
    }

    @Test
    void unansweredCommandTimesOut() {
        Event cmd = command();
        tracker.onEvent(cmd);
        assertEquals(1, tracker.pendingCount());

        clock.advanceMillis(4_999);
        scheduler.runDueTasks();
        assertTrue(sink.all().isEmpty());

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        Event timeout = sink.last();
        assertEquals(EventTypes.COMMAND_ACK_TIMEOUT, timeout.type());
        assertEquals(Stage.ACK, timeout.stage());
        assertEquals(EventStatus.TIMEOUT, timeout.status());
        assertEquals(cmd.eventId(), timeout.ackOfEventId());
        assertEquals(cmd.eventId(), timeout.parentEventId());
        assertEquals(cmd.traceId(), timeout.traceId());
        assertEquals("restart", timeout.payload().get("command").asText());
        assertEquals(0, tracker.pendingCount());
    }

    @Test
    void ackCancelsTheTimeout() {
        Event cmd = command();
        tracker.onEvent(cmd);
        tracker.onEvent(CommandAcks.ack(kernel, cmd, AckStatus.ACCEPTED, null));

        clock.advanceMillis(10_000);
        scheduler.runDueTasks();

        assertEquals(0, tracker.pendingCount());
        assertTrue(sink.all().isEmpty());
    }

    @Test
    void repeatedCommandEventIsTrackedOnce() {
        Event cmd = command();
        tracker.onEvent(cmd);
        tracker.onEvent(cmd);
        assertEquals(1, tracker.pendingCount());
        assertEquals(1, scheduler.pending());
    }

    @Test
    void ackStatusMapsOntoEventStatus() {
        Event cmd = command();

        Event accepted = CommandAcks.ack(kernel, cmd, AckStatus.ACCEPTED, null);
        Event rejected = CommandAcks.ack(kernel, cmd, AckStatus.REJECTED_NOT_ALIVE, "worker exited");
        Event dedup = CommandAcks.ack(kernel, cmd, AckStatus.BLOCKED_DEDUP, null);

        assertEquals(EventStatus.OK, accepted.status());
        assertEquals(EventStatus.FAILED, rejected.status());
        assertEquals("rejected_not_alive", rejected.payload().get("status").asText());
        assertEquals("worker exited", rejected.payload().get("detail").asText());
        assertEquals(EventStatus.DROPPED, dedup.status());
        assertEquals(cmd.eventId(), accepted.ackOfEventId());
        assertEquals(AckStatus.BLOCKED_DEDUP, AckStatus.fromWire("blocked_dedup").orElseThrow());
    }

    @Test
    void timeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new CommandAckTracker(sink, kernel, clock, scheduler, Duration.ZERO));
    }
}
