package com.questrail.kernel.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.bridge.BridgeLink;
import com.questrail.kernel.bridge.BridgeReceiver;
import com.questrail.kernel.bridge.BridgeSender;
import com.questrail.kernel.bridge.CommandAckTracker;
import com.questrail.kernel.bridge.DatagramEndpoint;
import com.questrail.kernel.bridge.Direction;
import com.questrail.kernel.bridge.netty.NettyUdpDatagramEndpoint;
import com.questrail.kernel.compaction.CompactionMonitor;
import com.questrail.kernel.compaction.CompactionPhase;
import com.questrail.kernel.config.KernelConfig;
import com.questrail.kernel.contract.ContractEvaluator;
import com.questrail.kernel.contract.Evaluation;
import com.questrail.kernel.contract.InjectionRequest;
import com.questrail.kernel.contract.PaneContractEngine;
import com.questrail.kernel.ingest.EnvelopeNormalizer;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.SamplingPolicy;
import com.questrail.kernel.ingest.SourceSequencer;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.ingest.TraceRootRegistry;
import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.observability.StoreObservabilityEvent;
import com.questrail.kernel.query.KernelQueryApi;
import com.questrail.kernel.query.TraceQueryEngine;
import com.questrail.kernel.store.EventStore;
import com.questrail.kernel.store.EventStores;
import com.questrail.kernel.store.LedgerWriter;
import com.questrail.kernel.store.PruneResult;
import com.questrail.kernel.store.SpanSweeper;
import com.questrail.kernel.time.Cancellable;
import com.questrail.kernel.time.MonotonicClock;
import com.questrail.kernel.time.MonotonicScheduler;
import com.questrail.kernel.time.ScheduledExecutorScheduler;
import com.questrail.kernel.time.SystemMonotonicClock;
import com.questrail.kernel.time.SystemWallClock;
import com.questrail.kernel.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * EventKernelRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the event kernel.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   producers ──submit/ingest──→ LedgerWriter ──append──→ EventStore ←── TraceQueryEngine
 *                                     │ committed events
 *                ┌────────────────────┼─────────────────────┐
 *                ↓                    ↓                     ↓
 *      PaneContractEngine     CompactionMonitor      CommandAckTracker
 *                ↑ phase              │
 *                └────────────────────┘
 * </pre>
 * Every component writes through the ledger writer; none touches the store
 * directly. Bridge links opened with {@link #openBridge} feed their inbound
 * records into the same writer.
 *
 * <h2>Periodic work</h2>
 * After {@link #start()}: retention pruning, compaction ticks and the span
 * sweep each run on the scheduler at their configured intervals.
 *
 * <h2>Manual drain</h2>
 * With {@link Builder#withManualDrain(boolean)} the writer thread is never
 * started and callers commit queued events with {@link #drain()}. Tests use
 * this together with a deterministic clock and scheduler.
 */
public final class EventKernelRuntime {
    private static final Logger log = LoggerFactory.getLogger(EventKernelRuntime.class);

    public static final String TERMINAL_SOURCE = "kernel.terminal";

    private final KernelConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedExecutor;
    private final KernelObservabilitySink observabilitySink;
    private final boolean manualDrain;

    private final SourceSequencer sequencer;
    private final EventStore store;
    private final LedgerWriter writer;
    private final PaneContractEngine contracts;
    private final CompactionMonitor compaction;
    private final CommandAckTracker acks;
    private final SpanSweeper sweeper;
    private final TraceQueryEngine queries;
    private final EventFactory terminalEvents;

    private final List<Cancellable> periodic = new ArrayList<>();
    private final List<BridgeLink> bridges = new ArrayList<>();
    private boolean started;

    private EventKernelRuntime(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.observabilitySink = b.observabilitySink;
        this.manualDrain = b.manualDrain;

        if (b.scheduler != null) {
            this.scheduler = b.scheduler;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "event-kernel-scheduler");
                t.setDaemon(true);
                return t;
            });
            this.scheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
        }

        this.sequencer = new SourceSequencer();
        this.store = b.store != null
                ? b.store
                : EventStores.open(config.storeDurable(), config.storeUrl(), config.retention(),
                        config.busyTimeout(), observabilitySink);

        EnvelopeNormalizer normalizer = new EnvelopeNormalizer(
                wallClock,
                sequencer,
                new TraceRootRegistry(100_000),
                SamplingPolicy.defaults().withDevMode(config.samplingDevMode()));
        this.writer = new LedgerWriter(normalizer, store, config.writerQueueCapacity(),
                factory(LedgerWriter.SOURCE), observabilitySink);

        this.contracts = new PaneContractEngine(
                writer,
                factory(PaneContractEngine.SOURCE),
                clock,
                scheduler,
                config.contractTiming(),
                ContractEvaluator.defaults(),
                observabilitySink);
        this.compaction = new CompactionMonitor(
                writer,
                factory(CompactionMonitor.SOURCE),
                clock,
                config.compaction(),
                contracts,
                observabilitySink);
        this.acks = new CommandAckTracker(writer, factory(BridgeLink.SOURCE), clock, scheduler, config.ackTimeout());
        this.sweeper = new SpanSweeper(store, writer, factory("kernel.sweeper"), config.spanTimeout());
        this.queries = new TraceQueryEngine(store, wallClock, config.spanTimeout());
        this.terminalEvents = factory(TERMINAL_SOURCE);

        writer.addListener(contracts::onEvent);
        writer.addListener(compaction::onEvent);
        writer.addListener(acks::onEvent);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        if (!manualDrain) {
            writer.start();
        }
        periodic.add(every("retention prune", config.retention().pruneInterval(), this::prune));
        periodic.add(every("compaction tick", config.compactionTickInterval(), compaction::tick));
        periodic.add(every("span sweep", config.spanSweepInterval(), sweeper::sweep));
        log.info("Event kernel started (store={}, manualDrain={})", store.status().backend(), manualDrain);
    }

    public synchronized void stop() {
        for (BridgeLink link : bridges) {
            link.stop();
        }
        bridges.clear();
        periodic.forEach(Cancellable::cancel);
        periodic.clear();
        contracts.close();
        acks.close();
        writer.stop();
        store.close();

        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        started = false;
        log.info("Event kernel stopped");
    }

    private Cancellable every(String name, Duration interval, Runnable body) {
        return PeriodicTask.start(name, interval, scheduler, clock, wallClock, observabilitySink, body);
    }

    private void prune() {
        PruneResult r = store.prune(wallClock.nowMillis());
        if (r.eventsRemoved() > 0) {
            observabilitySink.onStoreEvent(new StoreObservabilityEvent(wallClock.now(), "pruned",
                    r.eventsExpired() + " expired, " + r.eventsOverCap() + " over cap"));
        }
    }

    // ---------------------------------------------------------------------
    // Producer surface
    // ---------------------------------------------------------------------

    /**
     * Record a canonical event built in-process.
     */
    public void emit(Event event) {
        writer.submit(event);
    }

    /**
     * Record a raw record from an external producer.
     */
    public void ingest(JsonNode raw) {
        writer.submitRaw(raw);
    }

    public Evaluation submit(InjectionRequest request) {
        return contracts.submit(request);
    }

    /**
     * A chunk of a worker's terminal output: scored for compaction and recorded
     * as {@code terminal.output} (metadata only unless sampling dev mode is on).
     *
     * @return the worker's compaction phase after the chunk
     */
    public CompactionPhase onTerminalOutput(String workerId, String chunk) {
        Objects.requireNonNull(workerId, "workerId");
        CompactionPhase phase = compaction.onOutput(workerId, chunk);
        ObjectNode payload = EventJson.objectNode();
        payload.put("chunk", chunk == null ? "" : chunk);
        writer.submit(terminalEvents.builder(EventTypes.TERMINAL_OUTPUT, Stage.TERMINAL, TraceContext.origin(workerId))
                .payload(payload)
                .build());
        return phase;
    }

    /**
     * Event factory sharing this kernel's clock and sequence counters.
     */
    public EventFactory factory(String source) {
        return new EventFactory(source, wallClock, sequencer);
    }

    /**
     * Commit everything queued so far on the calling thread.
     */
    public int drain() {
        return writer.drain();
    }

    // ---------------------------------------------------------------------
    // Bridge
    // ---------------------------------------------------------------------

    /**
     * Open a UDP bridge link bound to {@code bindAddress}, sending to {@code peer}.
     */
    public BridgeLink openBridge(InetSocketAddress bindAddress, SocketAddress peer, Direction direction) {
        return openBridge(new NettyUdpDatagramEndpoint(bindAddress), peer, direction);
    }

    public synchronized BridgeLink openBridge(DatagramEndpoint endpoint, SocketAddress peer, Direction direction) {
        EventFactory bridgeEvents = factory(BridgeLink.SOURCE);
        BridgeSender sender = new BridgeSender(endpoint, peer, direction, config.bridgeQueueCapacity(),
                writer, bridgeEvents, observabilitySink);
        BridgeReceiver receiver = new BridgeReceiver(writer::submitRaw, writer, bridgeEvents, observabilitySink);
        BridgeLink link = new BridgeLink(endpoint, sender, receiver, writer, bridgeEvents, observabilitySink);
        try {
            link.start();
        } catch (RuntimeException e) {
            observabilitySink.onError(new KernelErrorEvent(wallClock.now(), "bridge failed to start", e));
            throw e;
        }
        bridges.add(link);
        return link;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public KernelQueryApi queries() {
        return queries;
    }

    public PaneContractEngine contracts() {
        return contracts;
    }

    public CompactionMonitor compaction() {
        return compaction;
    }

    public CommandAckTracker acks() {
        return acks;
    }

    public SpanSweeper sweeper() {
        return sweeper;
    }

    public EventStore store() {
        return store;
    }

    public LedgerWriter writer() {
        return writer;
    }

    public KernelConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private KernelConfig config = KernelConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private KernelObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private EventStore store;
        private boolean manualDrain;

        public Builder withConfig(KernelConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Use {@code scheduler} instead of an owned single-thread executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(KernelObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Use an already opened store instead of opening one from the config.
         */
        public Builder withStore(EventStore store) {
            this.store = store;
            return this;
        }

        public Builder withManualDrain(boolean manualDrain) {
            this.manualDrain = manualDrain;
            return this;
        }

        public EventKernelRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            return new EventKernelRuntime(this);
        }
    }
}
