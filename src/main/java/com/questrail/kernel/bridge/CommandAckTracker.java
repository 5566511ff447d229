package com.questrail.kernel.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.time.Cancellable;
import com.questrail.kernel.time.MonotonicClock;
import com.questrail.kernel.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Watches committed commands for their acknowledgment.
 *
 * <p>A {@code command.requested} with no {@code command.ack} naming it within
 * the timeout gets a {@code command.ack.timeout}: stage {@code ack}, status
 * {@code timeout}, parented on and {@code ackOfEventId} pointing to the command.
 * An ack that arrives later is still recorded as sent; it only no longer
 * cancels anything.</p>
 */
public final class CommandAckTracker {
    private static final Logger log = LoggerFactory.getLogger(CommandAckTracker.class);

    private record Pending(Event command, Cancellable timer) {}

    private final EventSink sink;
    private final EventFactory events;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration ackTimeout;

    private final Map<String, Pending> pending = new LinkedHashMap<>();

    public CommandAckTracker(EventSink sink,
                             EventFactory events,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             Duration ackTimeout)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
        if (ackTimeout.isNegative() || ackTimeout.isZero()) {
            throw new IllegalArgumentException("ackTimeout must be positive");
        }
    }

    public synchronized void onEvent(Event event) {
        Objects.requireNonNull(event, "event");
        switch (event.type()) {
            case EventTypes.COMMAND_REQUESTED -> track(event);
            case EventTypes.COMMAND_ACK -> acknowledge(event);
            default -> {
                // Not part of the command path.
            }
        }
    }

    private void track(Event command) {
        String id = command.eventId();
        if (pending.containsKey(id)) {
            return;
        }
        Cancellable timer = scheduler.scheduleAfter(ackTimeout, clock, () -> expire(id));
        pending.put(id, new Pending(command, timer));
    }

    private void acknowledge(Event ack) {
        String of = ack.ackOfEventId() != null ? ack.ackOfEventId() : ack.parentEventId();
        Pending p = of == null ? null : pending.remove(of);
        if (p != null) {
            p.timer().cancel();
        }
    }

    private synchronized void expire(String commandEventId) {
        Pending p = pending.remove(commandEventId);
        if (p == null) {
            return;
        }
        Event command = p.command();
        log.warn("No ack for command {} within {} ms", commandEventId, ackTimeout.toMillis());
        ObjectNode payload = EventJson.objectNode();
        String name = EventJson.text(command.payload(), "command");
        if (name != null) {
            payload.put("command", name);
        }
        payload.put("timeoutMs", ackTimeout.toMillis());
        sink.emit(events.builder(EventTypes.COMMAND_ACK_TIMEOUT, Stage.ACK, TraceContext.after(command))
                .status(EventStatus.TIMEOUT)
                .ackOfEventId(command.eventId())
                .payload(payload)
                .build());
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized void close() {
        pending.values().forEach(p -> p.timer().cancel());
        pending.clear();
    }
}
