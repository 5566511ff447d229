package com.questrail.kernel.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventClass;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTaxonomy;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.ingest.EnvelopeNormalizer;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.NormalizationResult;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LedgerWriter
 * =============================================================================
 * The single append path into the evidence ledger.
 *
 * <h2>Threading Model</h2>
 * Producers on any thread call {@link #submit(Event)} or {@link #submitRaw(JsonNode)};
 * both only enqueue. One writer thread (after {@link #start()}) or the caller of
 * {@link #drain()} takes items in submission order, normalizes them, appends them
 * and publishes every committed event to the registered listeners. Listeners
 * therefore see events in commit order, one at a time.
 *
 * <h2>Back-pressure</h2>
 * The queue is bounded. On overflow:
 * <ol>
 *   <li>the oldest queued telemetry item is evicted to make room, else</li>
 *   <li>an incoming telemetry item is dropped, else</li>
 *   <li>the item is admitted past capacity.</li>
 * </ol>
 * Contract, lifecycle and system events are never dropped. Every eviction is
 * accounted for in an {@code event.dropped} summary committed ahead of the next
 * item.
 *
 * <h2>Refusals</h2>
 * An event the store refuses is recorded as well: {@code event.invalid} when it
 * fails validation, {@code event.dropped} when the write path is busy or
 * fails.
 */
public final class LedgerWriter implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    public static final String SOURCE = "kernel.ledger";

    /**
     * Observer of committed events.
     */
    @FunctionalInterface
    public interface CommitListener {
        void onCommitted(Event event);
    }

    private record Pending(Event event, JsonNode raw, EventClass eventClass) {}

    private final EnvelopeNormalizer normalizer;
    private final EventStore store;
    private final int capacity;
    private final EventFactory diagnostics;
    private final KernelObservabilitySink observabilitySink;

    private final List<CommitListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition notEmpty = queueLock.newCondition();
    private final Deque<Pending> queue = new ArrayDeque<>();
    private final Map<String, Long> droppedByType = new TreeMap<>();
    private long droppedCount;
    private long droppedTotal;

    private final ReentrantLock processLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread writerThread;

    public LedgerWriter(EnvelopeNormalizer normalizer,
                        EventStore store,
                        int capacity,
                        EventFactory diagnostics,
                        KernelObservabilitySink observabilitySink)
    {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.store = Objects.requireNonNull(store, "store");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public void addListener(CommitListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public EventStore store() {
        return store;
    }

    // ---------------------------------------------------------------------
    // Producer side
    // ---------------------------------------------------------------------

    /**
     * Enqueue a canonical event produced in-process.
     */
    public void submit(Event event) {
        Objects.requireNonNull(event, "event");
        enqueue(new Pending(event, null, event.eventClass()));
    }

    /**
     * Enqueue a raw record from an external producer; it is normalized on the
     * writer side.
     */
    public void submitRaw(JsonNode raw) {
        Objects.requireNonNull(raw, "raw");
        String type = EventJson.text(raw, "type");
        EventClass cls = type != null ? EventTaxonomy.classify(type) : EventClass.SYSTEM;
        enqueue(new Pending(null, raw.deepCopy(), cls));
    }

    @Override
    public void emit(Event event) {
        submit(event);
    }

    private void enqueue(Pending item) {
        queueLock.lock();
        try {
            if (queue.size() >= capacity) {
                if (!evictOldestTelemetry()) {
                    if (item.eventClass().isDroppable()) {
                        recordDrop(typeOf(item));
                        return;
                    }
                    log.debug("Ledger queue over capacity ({}); admitting {} item", capacity, item.eventClass());
                }
            }
            queue.addLast(item);
            notEmpty.signal();
        } finally {
            queueLock.unlock();
        }
    }

    private boolean evictOldestTelemetry() {
        for (Iterator<Pending> it = queue.iterator(); it.hasNext(); ) {
            Pending p = it.next();
            if (p.eventClass().isDroppable()) {
                it.remove();
                recordDrop(typeOf(p));
                return true;
            }
        }
        return false;
    }

    private void recordDrop(String type) {
        droppedCount++;
        droppedTotal++;
        droppedByType.merge(type, 1L, Long::sum);
    }

    private static String typeOf(Pending p) {
        if (p.event() != null) {
            return p.event().type();
        }
        String type = EventJson.text(p.raw(), "type");
        return type != null ? type : "unknown";
    }

    public int queueDepth() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    public long droppedTotal() {
        queueLock.lock();
        try {
            return droppedTotal;
        } finally {
            queueLock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Writer side
    // ---------------------------------------------------------------------

    /**
     * Start the writer thread. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            writerThread = new Thread(this::runWriterLoop, "event-kernel-ledger-writer");
            writerThread.setDaemon(true);
            writerThread.start();
        }
    }

    /**
     * Stop the writer thread, then commit whatever is still queued on the
     * calling thread.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = writerThread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        drain();
    }

    /**
     * Commit everything queued so far on the calling thread.
     *
     * @return number of items taken from the queue
     */
    public int drain() {
        int n = 0;
        processLock.lock();
        try {
            Pending next;
            while ((next = poll()) != null) {
                process(next);
                n++;
            }
            flushDropSummary();
        } finally {
            processLock.unlock();
        }
        return n;
    }

    private Pending poll() {
        queueLock.lock();
        try {
            return queue.pollFirst();
        } finally {
            queueLock.unlock();
        }
    }

    private void runWriterLoop() {
        while (running.get()) {
            try {
                Pending next = awaitNext();
                processLock.lock();
                try {
                    process(next);
                    if (queueDepth() == 0) {
                        flushDropSummary();
                    }
                } finally {
                    processLock.unlock();
                }
            } catch (InterruptedException e) {
                // Expected during shutdown; otherwise the flag is already cleared and the loop continues.
                if (running.get()) {
                    log.warn("Ledger writer interrupted while running; continuing");
                }
            } catch (RuntimeException e) {
                log.error("Ledger writer loop failed", e);
                observabilitySink.onError(new KernelErrorEvent(
                        diagnostics.wallClock().now(), "Ledger writer loop failed", e));
            }
        }
    }

    private Pending awaitNext() throws InterruptedException {
        queueLock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                notEmpty.await();
            }
            return queue.pollFirst();
        } finally {
            queueLock.unlock();
        }
    }

    private void process(Pending item) {
        flushDropSummary();
        NormalizationResult result = item.event() != null
                ? normalizer.admit(item.event())
                : normalizer.normalize(item.raw());
        for (Event e : result.toAppend()) {
            commit(e);
        }
    }

    private void flushDropSummary() {
        long count;
        Map<String, Long> types;
        queueLock.lock();
        try {
            if (droppedCount == 0) {
                return;
            }
            count = droppedCount;
            types = new TreeMap<>(droppedByType);
            droppedCount = 0;
            droppedByType.clear();
        } finally {
            queueLock.unlock();
        }

        ObjectNode payload = EventJson.objectNode();
        payload.put("reason", "queue_overflow");
        payload.put("droppedCount", count);
        ObjectNode byType = payload.putObject("types");
        types.forEach(byType::put);

        log.warn("Ledger queue overflow: {} telemetry events dropped {}", count, types);
        commit(diagnostics.builder(EventTypes.EVENT_DROPPED, Stage.SYSTEM, TraceContext.origin("system"))
                .status(EventStatus.DROPPED)
                .payload(payload)
                .build());
    }

    private void commit(Event event) {
        commit(event, true);
    }

    /**
     * @param reportRefusal record a refusal by the store as a diagnostic event;
     *                      {@code false} for the diagnostics themselves
     */
    private void commit(Event event, boolean reportRefusal) {
        AppendResult result = store.append(event);
        switch (result.status()) {
            case INSERTED -> publish(event);
            case DUPLICATE -> log.debug("Event {} already in ledger", event.eventId());
            case INVALID -> {
                log.warn("Event {} refused by ledger: {}", event.eventId(), result.reason());
                if (reportRefusal) {
                    commit(refused(EventTypes.EVENT_INVALID, EventStatus.FAILED, event, result), false);
                }
            }
            case BUSY, FAILED -> {
                log.error("Event {} not committed ({}): {}", event.eventId(), result.status(), result.reason());
                if (reportRefusal) {
                    commit(refused(EventTypes.EVENT_DROPPED, EventStatus.DROPPED, event, result), false);
                }
            }
        }
    }

    private Event refused(String type, EventStatus status, Event event, AppendResult result) {
        ObjectNode payload = EventJson.objectNode();
        if (type.equals(EventTypes.EVENT_INVALID)) {
            payload.putArray("errors").add(result.reason());
        } else {
            payload.put("reason", "store_" + result.status().name().toLowerCase(Locale.ROOT));
            payload.put("droppedCount", 1);
            payload.putObject("types").put(event.type(), 1);
            payload.put("error", result.reason());
        }
        payload.put("rawEventId", event.eventId());
        payload.put("rawType", event.type());
        payload.put("rawSource", event.source());
        return diagnostics.builder(type, Stage.SYSTEM, TraceContext.origin("system"))
                .status(status)
                .payload(payload)
                .build();
    }

    private void publish(Event event) {
        for (CommitListener listener : listeners) {
            try {
                listener.onCommitted(event);
            } catch (RuntimeException e) {
                log.error("Commit listener failed on {}", event.eventId(), e);
                observabilitySink.onError(new KernelErrorEvent(
                        diagnostics.wallClock().now(), "Commit listener failed on " + event.type(), e));
            }
        }
    }
}
