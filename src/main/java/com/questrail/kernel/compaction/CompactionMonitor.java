package com.questrail.kernel.compaction;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.CompactionTransitionEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CompactionMonitor
 * =============================================================================
 * Runs one {@link CompactionDetector} per worker over its terminal output and
 * publishes every phase change.
 *
 * <h2>Events</h2>
 * <pre>
 *   none → suspected           cli.compaction.suspected   (opens an episode trace)
 *   suspected | cooldown → confirmed   cli.compaction.started
 *   confirmed → cooldown       cli.compaction.ended       (carries durationMs)
 *   suspected | cooldown → none        cli.compaction.cleared (closes the episode)
 * </pre>
 * Events of one episode share a trace and are chained by parent links.
 *
 * <h2>Gate</h2>
 * The {@link CompactionGateListener} hears the new phase before the event is
 * handed to the sink, so the contract engine never gates on a stale phase.
 *
 * <h2>Threading Model</h2>
 * All public methods are synchronized. {@link #tick()} is expected from a
 * scheduler thread and {@link #onOutput} from terminal readers.
 */
public final class CompactionMonitor {
    private static final Logger log = LoggerFactory.getLogger(CompactionMonitor.class);

    public static final String SOURCE = "kernel.compaction";
    public static final int DETECTOR_VERSION = 1;

    private final EventSink sink;
    private final EventFactory events;
    private final MonotonicClock clock;
    private final CompactionDetector detector;
    private final CompactionGateListener gate;
    private final KernelObservabilitySink observabilitySink;

    private final Map<String, Worker> workers = new LinkedHashMap<>();

    public CompactionMonitor(EventSink sink,
                             EventFactory events,
                             MonotonicClock clock,
                             CompactionThresholds thresholds,
                             CompactionGateListener gate,
                             KernelObservabilitySink observabilitySink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.detector = new CompactionDetector(Objects.requireNonNull(thresholds, "thresholds"));
        this.gate = gate;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Score a chunk of a worker's output and advance its detector.
     *
     * @return the worker's phase after the chunk
     */
    public synchronized CompactionPhase onOutput(String workerId, String chunk) {
        Objects.requireNonNull(workerId, "workerId");
        Worker w = worker(workerId);
        long now = clock.nowMillis();
        return advance(w, now, w.scorer.score(chunk, now));
    }

    /**
     * Advance every worker's timers without new output.
     */
    public synchronized void tick() {
        long now = clock.nowMillis();
        for (Worker w : new ArrayList<>(workers.values())) {
            advance(w, now, CompactionSignal.tick());
        }
    }

    /**
     * Committed stream: injections count as causation for the output that
     * follows them; a restart discards the worker's detector.
     */
    public synchronized void onEvent(Event event) {
        Objects.requireNonNull(event, "event");
        switch (event.type()) {
            case EventTypes.INJECT_REQUESTED -> worker(event.workerId()).scorer.onInjectRequested(clock.nowMillis());
            case EventTypes.WORKER_RESTARTED -> restart(event.workerId());
            default -> {
                // Not an input.
            }
        }
    }

    public synchronized CompactionPhase phase(String workerId) {
        Worker w = workers.get(workerId);
        return w == null ? CompactionPhase.NONE : w.state.phase();
    }

    public synchronized DetectorState state(String workerId) {
        Worker w = workers.get(workerId);
        return w == null ? DetectorState.initial() : w.state;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private CompactionPhase advance(Worker w, long now, CompactionSignal signal) {
        DetectorState before = w.state;
        Transition t = detector.advance(before, now, signal);
        w.state = t.state();
        if (t.changed()) {
            publish(w, before, t, now);
        }
        return w.state.phase();
    }

    private void restart(String workerId) {
        Worker w = workers.remove(workerId);
        if (w == null || w.state.phase() == CompactionPhase.NONE) {
            return;
        }
        log.info("Worker {} restarted during compaction phase {}", workerId, w.state.phase());
        DetectorState cleared = DetectorState.initial();
        publish(w, w.state, new Transition(cleared, w.state.phase(), CompactionPhase.NONE, "worker_restarted"),
                clock.nowMillis());
    }

    private void publish(Worker w, DetectorState before, Transition t, long now) {
        if (gate != null) {
            try {
                gate.onCompactionPhase(w.workerId, t.to());
            } catch (RuntimeException e) {
                log.error("Compaction gate failed for worker {}", w.workerId, e);
            }
        }
        observabilitySink.onCompactionTransition(new CompactionTransitionEvent(
                events.wallClock().now(), w.workerId, t.from().wireName(), t.to().wireName(),
                t.state().confidence(), t.reason()));

        String type = eventType(t);
        if (w.episodeTraceId == null) {
            w.episodeTraceId = TraceContext.origin(w.workerId).traceId();
            w.lastEventId = null;
        }

        ObjectNode payload = EventJson.objectNode();
        payload.put("phase", t.to().wireName());
        payload.put("fromPhase", t.from().wireName());
        payload.put("confidence", t.state().confidence());
        payload.put("reason", t.reason());
        ArrayNode signals = payload.putArray("signals");
        Set<SignalKind> kinds = t.state().signals().isEmpty()
                ? EnumSet.noneOf(SignalKind.class)
                : EnumSet.copyOf(t.state().signals());
        kinds.forEach(k -> signals.add(k.wireName()));
        payload.put("detectorVersion", DETECTOR_VERSION);
        if (t.from() == CompactionPhase.CONFIRMED && before.confirmedAt() != DetectorState.UNSET) {
            payload.put("durationMs", now - before.confirmedAt());
        }

        Event e = events.builder(type, Stage.TERMINAL,
                        TraceContext.of(w.episodeTraceId, w.lastEventId, w.workerId))
                .payload(payload)
                .build();
        w.lastEventId = e.eventId();
        if (t.to() == CompactionPhase.NONE) {
            w.episodeTraceId = null;
            w.lastEventId = null;
        }
        sink.emit(e);
    }

    private static String eventType(Transition t) {
        return switch (t.to()) {
            case SUSPECTED -> EventTypes.COMPACTION_SUSPECTED;
            case CONFIRMED -> EventTypes.COMPACTION_STARTED;
            case COOLDOWN -> EventTypes.COMPACTION_ENDED;
            case NONE -> EventTypes.COMPACTION_CLEARED;
        };
    }

    private Worker worker(String workerId) {
        return workers.computeIfAbsent(workerId, id -> new Worker(id, new OutputSignalScorer(detector.thresholds())));
    }

    private static final class Worker {
        final String workerId;
        final OutputSignalScorer scorer;
        DetectorState state = DetectorState.initial();
        String episodeTraceId;
        String lastEventId;

        Worker(String workerId, OutputSignalScorer scorer) {
            this.workerId = workerId;
            this.scorer = scorer;
        }
    }
}
