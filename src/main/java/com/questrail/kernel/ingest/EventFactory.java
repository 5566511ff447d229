package com.questrail.kernel.ingest;

import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventIds;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.time.WallClock;

import java.util.Objects;

/**
 * Builds canonical events for one in-process producer.
 *
 * <p>Each call opens a new span, stamps the wall clock and takes the next
 * sequence for {@code source}. Callers adjust the returned builder (status,
 * payload, span) before building.</p>
 */
public final class EventFactory {

    private final String source;
    private final WallClock wallClock;
    private final SourceSequencer sequencer;

    public EventFactory(String source, WallClock wallClock, SourceSequencer sequencer) {
        this.source = Objects.requireNonNull(source, "source");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
    }

    public Event.Builder builder(String type, Stage stage, TraceContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        return Event.builder()
                .eventId(EventIds.newEventId())
                .traceId(ctx.traceId())
                .parentEventId(ctx.parentEventId())
                .spanId(EventIds.newSpanId())
                .type(type)
                .stage(stage)
                .source(source)
                .workerId(ctx.workerId())
                .timestamp(wallClock.nowMillis())
                .sequence(sequencer.next(source))
                .status(EventStatus.OK);
    }

    public String source() {
        return source;
    }

    public WallClock wallClock() {
        return wallClock;
    }
}
