package com.questrail.kernel.contract;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventIds;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventSink;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTypes;
import com.questrail.kernel.api.Stage;
import com.questrail.kernel.compaction.CompactionGateListener;
import com.questrail.kernel.compaction.CompactionMonitor;
import com.questrail.kernel.compaction.CompactionPhase;
import com.questrail.kernel.ingest.EventFactory;
import com.questrail.kernel.ingest.TraceContext;
import com.questrail.kernel.observability.ContractDecisionEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.time.Cancellable;
import com.questrail.kernel.time.MonotonicClock;
import com.questrail.kernel.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * PaneContractEngine
 * =============================================================================
 * Gates injection into workers' panes and records every decision in the ledger.
 *
 * <h2>Request lifecycle</h2>
 * <pre>
 *   inject.requested ─┬─ allow ────────────────────────→ inject.applied
 *                     ├─ override → contract.override ─→ inject.applied
 *                     ├─ defer → inject.deferred ─┬─ gates clear → inject.resumed → inject.applied
 *                     │                           ├─ reasons change → inject.deferred (attempt + 1)
 *                     │                           └─ TTL expiry / restart → inject.dropped
 *                     └─ block → contract.violation
 *   inject.applied → inject.submit.sent → inject.verified | inject.failed
 * </pre>
 * An applied injection owns its operation class for at most the owner lease.
 * When the lease runs out first the request fails with
 * {@code owner_lease_expired} and the class is released.
 * Each step is its own event in the request's trace, parented on the step
 * before. Nothing is dropped without an {@code inject.dropped} event naming the
 * reason.
 *
 * <h2>State</h2>
 * Per-worker state lives in a {@link WorkerContext}. Lanes change when matching
 * events arrive through {@link #onEvent(Event)} or when a compaction monitor
 * pushes a phase. Every change re-evaluates that worker's deferred requests.
 *
 * <h2>Safe mode</h2>
 * A burst of contract violations puts every worker into safe mode for a fixed
 * period, during which normal-priority work is deferred.
 *
 * <h2>Threading Model</h2>
 * All public methods are synchronized. Timer callbacks from the scheduler take
 * the same lock. Events are handed to the {@link EventSink}, which only
 * enqueues, so the engine never re-enters itself through its own output.
 */
public final class PaneContractEngine implements CompactionGateListener {
    private static final Logger log = LoggerFactory.getLogger(PaneContractEngine.class);

    public static final String SOURCE = "kernel.contract";

    static final String TTL_EXPIRED = "ttl_expired";
    static final String WORKER_RESTARTED = "worker_restarted";
    static final String OWNER_LEASE_EXPIRED = "owner_lease_expired";

    private final EventSink sink;
    private final EventFactory events;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ContractTimingPolicy policy;
    private final ContractEvaluator evaluator;
    private final KernelObservabilitySink observabilitySink;

    private final Map<String, WorkerContext> workers = new LinkedHashMap<>();
    private final Map<String, String> workerByRequest = new HashMap<>();
    private final Deque<Long> violationTimes = new ArrayDeque<>();
    private boolean safeMode;
    private Cancellable safeModeExit;

    public PaneContractEngine(EventSink sink,
                              EventFactory events,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              ContractTimingPolicy policy,
                              ContractEvaluator evaluator,
                              KernelObservabilitySink observabilitySink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    /**
     * Record and evaluate a request.
     *
     * @return the evaluation; the request has been applied, deferred, blocked or
     *         coalesced accordingly
     */
    public synchronized Evaluation submit(InjectionRequest request) {
        Objects.requireNonNull(request, "request");
        WorkerContext ctx = context(request.workerId());

        TraceContext origin = request.traceId() != null
                ? TraceContext.of(request.traceId(), request.parentEventId(), request.workerId())
                : TraceContext.origin(request.workerId());
        String type = request.kind() == RequestKind.RESIZE ? EventTypes.RESIZE_REQUESTED : EventTypes.INJECT_REQUESTED;
        ObjectNode requestedPayload = requestRef(request);
        requestedPayload.set("request", request.payload());
        Event requested = emit(events.builder(type, Stage.ROUTE, origin)
                .payload(requestedPayload)
                .build());

        Evaluation eval = evaluator.evaluate(ctx, request);
        TraceContext after = TraceContext.after(requested);
        switch (eval.decision()) {
            case ALLOW -> apply(ctx, request, after);
            case OVERRIDE -> apply(ctx, request, TraceContext.after(override(request, eval, after)));
            case DEFER -> defer(ctx, request, requested, eval.reasons());
            case BLOCK -> violation(request, eval, after);
            case COALESCE -> coalesce(ctx, request, after);
        }
        return eval;
    }

    /**
     * The injector handed the request to the transport.
     *
     * @return {@code false} if the request is not in flight
     */
    public synchronized boolean recordSubmitSent(String requestId) {
        WorkerContext ctx = contextOfRequest(requestId);
        WorkerContext.InFlight f = ctx == null ? null : inFlight(ctx, requestId);
        if (f == null) {
            log.warn("submit.sent for unknown request {}", requestId);
            return false;
        }
        Event sent = emit(events.builder(EventTypes.INJECT_SUBMIT_SENT, Stage.TRANSPORT,
                        TraceContext.of(f.traceId(), f.lastEventId(), ctx.workerId()))
                .payload(requestRef(f.request()))
                .build());
        ctx.inFlight().put(f.request().kind().operationClass(), f.advancedTo(sent.eventId()));
        return true;
    }

    public synchronized boolean recordVerified(String requestId) {
        return finish(requestId, EventTypes.INJECT_VERIFIED, EventStatus.OK, null);
    }

    public synchronized boolean recordFailed(String requestId, String reason) {
        return finish(requestId, EventTypes.INJECT_FAILED, EventStatus.FAILED, reason);
    }

    private boolean finish(String requestId, String type, EventStatus status, String reason) {
        WorkerContext ctx = contextOfRequest(requestId);
        WorkerContext.InFlight f = ctx == null ? null : inFlight(ctx, requestId);
        if (f == null) {
            log.warn("{} for unknown request {}", type, requestId);
            return false;
        }
        ObjectNode payload = requestRef(f.request());
        if (reason != null) {
            payload.put("reason", reason);
        }
        emit(events.builder(type, Stage.VERIFY, TraceContext.of(f.traceId(), f.lastEventId(), ctx.workerId()))
                .status(status)
                .payload(payload)
                .build());
        release(ctx, f);
        return true;
    }

    private void apply(WorkerContext ctx, InjectionRequest request, TraceContext parent) {
        if (request.kind() == RequestKind.RESIZE) {
            ObjectNode payload = requestRef(request);
            payload.setAll(request.payload());
            emit(events.builder(EventTypes.RESIZE_APPLIED, Stage.INJECT, parent).payload(payload).build());
            return;
        }

        Event applied = emit(events.builder(EventTypes.INJECT_APPLIED, Stage.INJECT, parent)
                .payload(requestRef(request))
                .build());
        if (request.kind().holdsOwnership()) {
            Cancellable lease = scheduler.scheduleAfter(policy.ownerLease(), clock,
                    () -> leaseExpired(request.requestId()));
            ctx.inFlight().put(request.kind().operationClass(),
                    new WorkerContext.InFlight(request, applied.traceId(), applied.eventId(), lease));
            workerByRequest.put(request.requestId(), ctx.workerId());
            ctx.updateState(ctx.state().withActivity(Activity.INJECTING));
        }
    }

    /**
     * No verdict arrived within the owner lease: fail the request and free its
     * operation class.
     */
    private synchronized void leaseExpired(String requestId) {
        WorkerContext ctx = contextOfRequest(requestId);
        if (ctx == null || inFlight(ctx, requestId) == null) {
            return;
        }
        log.warn("Request {} on {} held {} for {}ms without a verdict; releasing",
                requestId, ctx.workerId(), RequestKind.INJECT.operationClass(), policy.ownerLease().toMillis());
        finish(requestId, EventTypes.INJECT_FAILED, EventStatus.FAILED, OWNER_LEASE_EXPIRED);
    }

    private void release(WorkerContext ctx, WorkerContext.InFlight f) {
        f.cancelLease();
        ctx.inFlight().remove(f.request().kind().operationClass());
        workerByRequest.remove(f.request().requestId());
        if (ctx.inFlight().isEmpty()) {
            ctx.updateState(ctx.state().withActivity(Activity.IDLE));
        }
        flushPendingResize(ctx);
        reevaluate(ctx);
    }

    private Event override(InjectionRequest request, Evaluation eval, TraceContext parent) {
        ObjectNode payload = requestRef(request);
        putStrings(payload.putArray("bypassed"), eval.reasonCodes());
        putStrings(payload.putArray("contractIds"), eval.contractIds());
        log.info("{} on {} overrides {}", request.kind(), request.workerId(), eval.reasonCodes());
        report(request, "override", eval.reasonCodes());
        return emit(events.builder(EventTypes.CONTRACT_OVERRIDE, Stage.ROUTE, parent)
                .payload(payload)
                .build());
    }

    private void violation(InjectionRequest request, Evaluation eval, TraceContext parent) {
        ObjectNode payload = requestRef(request);
        payload.put("kind", BlockReason.OWNERSHIP.code());
        payload.put("contractId", BlockReason.OWNERSHIP.contractId());
        payload.put("operationClass", request.kind().operationClass());
        if (eval.holder() != null) {
            payload.put("holder", eval.holder());
        }
        log.warn("Request {} on {} blocked: {} held by {}",
                request.requestId(), request.workerId(), request.kind().operationClass(), eval.holder());
        emit(events.builder(EventTypes.CONTRACT_VIOLATION, Stage.ROUTE, parent)
                .status(EventStatus.FAILED)
                .payload(payload)
                .build());
        report(request, "block", eval.reasonCodes());
        recordViolation();
    }

    // ---------------------------------------------------------------------
    // Deferral
    // ---------------------------------------------------------------------

    private void defer(WorkerContext ctx, InjectionRequest request, Event cause, List<BlockReason> reasons) {
        DeferredRequest d = new DeferredRequest(request, cause.traceId(), EventIds.newSpanId(), clock.nowNanos());
        d.attempt = 1;
        d.lastReasons = reasons;
        d.lastEventId = cause.eventId();
        d.lastEventId = emitDeferred(d).eventId();
        ctx.deferred().addLast(d);

        String workerId = ctx.workerId();
        d.ttlTimer = scheduler.scheduleAfter(policy.deferTtl(), clock, () -> expire(workerId, request.requestId()));
        log.info("Request {} on {} deferred: {}", request.requestId(), workerId, d.lastReasonCodes());
    }

    private Event emitDeferred(DeferredRequest d) {
        ObjectNode payload = requestRef(d.request);
        putStrings(payload.putArray("reasons"), d.lastReasonCodes());
        putStrings(payload.putArray("contractIds"),
                d.lastReasons.stream().map(BlockReason::contractId).distinct().toList());
        payload.put("ttlMs", policy.deferTtl().toMillis());
        payload.put("attempt", d.attempt);
        report(d.request, "defer", d.lastReasonCodes());
        return emit(events.builder(EventTypes.INJECT_DEFERRED, Stage.ROUTE,
                        TraceContext.of(d.traceId, d.lastEventId, d.request.workerId()))
                .spanId(d.spanId)
                .status(EventStatus.DEFERRED)
                .payload(payload)
                .build());
    }

    /**
     * Re-check every deferred request of {@code ctx}, oldest first.
     */
    private void reevaluate(WorkerContext ctx) {
        for (Iterator<DeferredRequest> it = ctx.deferred().iterator(); it.hasNext(); ) {
            DeferredRequest d = it.next();
            Evaluation eval = evaluator.evaluate(ctx, d.request);
            switch (eval.decision()) {
                case ALLOW -> {
                    it.remove();
                    resume(ctx, d);
                }
                case DEFER -> {
                    if (!eval.reasons().equals(d.lastReasons)) {
                        d.attempt++;
                        d.lastReasons = eval.reasons();
                        d.lastEventId = emitDeferred(d).eventId();
                    }
                }
                default -> {
                    // The operation class is held by a request applied meanwhile; wait for release.
                }
            }
        }
    }

    private synchronized void expire(String workerId, String requestId) {
        WorkerContext ctx = workers.get(workerId);
        if (ctx == null) {
            return;
        }
        DeferredRequest d = null;
        for (Iterator<DeferredRequest> it = ctx.deferred().iterator(); it.hasNext(); ) {
            DeferredRequest candidate = it.next();
            if (candidate.request.requestId().equals(requestId)) {
                it.remove();
                d = candidate;
                break;
            }
        }
        if (d == null) {
            return;
        }

        Evaluation eval = evaluator.evaluate(ctx, d.request);
        if (eval.decision() == Decision.ALLOW) {
            resume(ctx, d);
        } else {
            drop(d, TTL_EXPIRED, eval.reasons().isEmpty() ? d.lastReasons : eval.reasons());
        }
    }

    private void resume(WorkerContext ctx, DeferredRequest d) {
        cancelTimer(d);
        ObjectNode payload = requestRef(d.request);
        payload.put("attempt", d.attempt);
        payload.put("waitedMs", (clock.nowNanos() - d.deferredAtNanos) / 1_000_000L);
        Event resumed = emit(events.builder(EventTypes.INJECT_RESUMED, Stage.ROUTE,
                        TraceContext.of(d.traceId, d.lastEventId, ctx.workerId()))
                .spanId(d.spanId)
                .payload(payload)
                .build());
        report(d.request, "resume", List.of());
        apply(ctx, d.request, TraceContext.after(resumed));
    }

    private void drop(DeferredRequest d, String reason, List<BlockReason> reasons) {
        cancelTimer(d);
        List<String> codes = reasons.stream().map(BlockReason::code).toList();
        ObjectNode payload = requestRef(d.request);
        payload.put("reason", reason);
        putStrings(payload.putArray("reasons"), codes);
        payload.put("attempt", d.attempt);
        log.warn("Request {} on {} dropped: {} {}", d.request.requestId(), d.request.workerId(), reason, codes);
        emit(events.builder(EventTypes.INJECT_DROPPED, Stage.ROUTE,
                        TraceContext.of(d.traceId, d.lastEventId, d.request.workerId()))
                .spanId(d.spanId)
                .status(EventStatus.DROPPED)
                .payload(payload)
                .build());

        List<String> reported = new ArrayList<>(codes.size() + 1);
        reported.add(reason);
        reported.addAll(codes);
        report(d.request, "drop", reported);
    }

    private static void cancelTimer(DeferredRequest d) {
        if (d.ttlTimer != null) {
            d.ttlTimer.cancel();
            d.ttlTimer = null;
        }
    }

    // ---------------------------------------------------------------------
    // Resize coalescing
    // ---------------------------------------------------------------------

    private void coalesce(WorkerContext ctx, InjectionRequest request, TraceContext parent) {
        WorkerContext.PendingResize previous = ctx.pendingResize();
        ObjectNode payload = requestRef(request);
        payload.setAll(request.payload());
        ArrayNode superseded = payload.putArray("superseded");
        if (previous != null) {
            ObjectNode prior = superseded.addObject();
            prior.put("requestId", previous.request().requestId());
            prior.setAll(previous.request().payload());
        }
        Event coalesced = emit(events.builder(EventTypes.RESIZE_COALESCED, Stage.ROUTE, parent)
                .payload(payload)
                .build());
        ctx.pendingResize(new WorkerContext.PendingResize(request, coalesced.traceId(), coalesced.eventId(),
                previous == null ? 0 : previous.superseded() + 1));
    }

    private void flushPendingResize(WorkerContext ctx) {
        WorkerContext.PendingResize pending = ctx.pendingResize();
        if (pending == null || ctx.state().activity() == Activity.INJECTING) {
            return;
        }
        ctx.pendingResize(null);
        apply(ctx, pending.request(), TraceContext.of(pending.traceId(), pending.lastEventId(), ctx.workerId()));
    }

    // ---------------------------------------------------------------------
    // Safe mode
    // ---------------------------------------------------------------------

    private void recordViolation() {
        long now = clock.nowNanos();
        long windowStart = now - policy.safeModeWindow().toNanos();
        violationTimes.addLast(now);
        while (!violationTimes.isEmpty() && violationTimes.peekFirst() < windowStart) {
            violationTimes.pollFirst();
        }
        if (!safeMode && violationTimes.size() >= policy.safeModeViolations()) {
            enterSafeMode(violationTimes.size());
        }
    }

    private void enterSafeMode(int violations) {
        safeMode = true;
        violationTimes.clear();
        for (WorkerContext ctx : workers.values()) {
            ctx.updateState(ctx.state().withSafeMode(true));
        }

        ObjectNode payload = EventJson.objectNode();
        payload.put("violations", violations);
        payload.put("windowMs", policy.safeModeWindow().toMillis());
        payload.put("durationMs", policy.safeModeDuration().toMillis());
        log.warn("Entering safe mode after {} violations; normal-priority work deferred for {}ms",
                violations, policy.safeModeDuration().toMillis());
        emit(events.builder(EventTypes.SAFEMODE_ENTERED, Stage.SYSTEM, TraceContext.origin("system"))
                .payload(payload)
                .build());

        safeModeExit = scheduler.scheduleAfter(policy.safeModeDuration(), clock, this::exitSafeMode);
    }

    private synchronized void exitSafeMode() {
        if (!safeMode) {
            return;
        }
        safeMode = false;
        safeModeExit = null;
        log.info("Leaving safe mode");
        emit(events.builder(EventTypes.SAFEMODE_EXITED, Stage.SYSTEM, TraceContext.origin("system"))
                .build());
        for (WorkerContext ctx : new ArrayList<>(workers.values())) {
            if (ctx.updateState(ctx.state().withSafeMode(false))) {
                reevaluate(ctx);
            }
        }
    }

    public synchronized boolean isSafeMode() {
        return safeMode;
    }

    // ---------------------------------------------------------------------
    // Committed stream
    // ---------------------------------------------------------------------

    /**
     * Apply a committed event to the state vectors. Events this engine produced
     * itself are ignored.
     */
    public synchronized void onEvent(Event event) {
        Objects.requireNonNull(event, "event");
        if (SOURCE.equals(event.source())) {
            return;
        }
        switch (event.type()) {
            case EventTypes.PANE_FOCUS_LOCKED -> update(event.workerId(), s -> s.withFocusLocked(true));
            case EventTypes.PANE_FOCUS_RELEASED -> update(event.workerId(), s -> s.withFocusLocked(false));
            case EventTypes.COMPACTION_SUSPECTED -> compactionFromStream(event, CompactionPhase.SUSPECTED);
            case EventTypes.COMPACTION_STARTED -> compactionFromStream(event, CompactionPhase.CONFIRMED);
            case EventTypes.COMPACTION_ENDED -> compactionFromStream(event, CompactionPhase.COOLDOWN);
            case EventTypes.COMPACTION_CLEARED -> compactionFromStream(event, CompactionPhase.NONE);
            case EventTypes.BRIDGE_CONNECTED -> updateLink(event.workerId(), s -> s.withBridge(LinkState.UP));
            case EventTypes.BRIDGE_DISCONNECTED -> updateLink(event.workerId(), s -> s.withBridge(LinkState.DOWN));
            case EventTypes.TERMINAL_UP -> update(event.workerId(), s -> s.withTerminal(LinkState.UP));
            case EventTypes.TERMINAL_DOWN -> update(event.workerId(), s -> s.withTerminal(LinkState.DOWN));
            case EventTypes.WORKER_RESTARTED -> restart(event);
            case EventTypes.INJECT_SUBMIT_SENT -> advanceFromStream(event);
            case EventTypes.INJECT_VERIFIED, EventTypes.INJECT_FAILED -> releaseFromStream(event);
            default -> {
                // Not a state change.
            }
        }
    }

    @Override
    public synchronized void onCompactionPhase(String workerId, CompactionPhase phase) {
        updateCompaction(workerId, phase);
    }

    /**
     * Phases from a remote detector. The local monitor pushes its phases through
     * {@link #onCompactionPhase} before its events are committed, so its
     * committed events would only replay stale phases.
     */
    private void compactionFromStream(Event event, CompactionPhase phase) {
        if (!CompactionMonitor.SOURCE.equals(event.source())) {
            updateCompaction(event.workerId(), phase);
        }
    }

    private void updateCompaction(String workerId, CompactionPhase phase) {
        update(workerId, s -> s.withCompacting(phase));
    }

    private void update(String workerId, UnaryOperator<PaneStateVector> change) {
        WorkerContext ctx = context(workerId);
        PaneStateVector before = ctx.state();
        if (ctx.updateState(change.apply(before))) {
            log.debug("Worker {} state {} -> {}", workerId, before, ctx.state());
            reevaluate(ctx);
        }
    }

    /**
     * Link events from the {@code system} worker describe a shared link and
     * apply to every known worker.
     */
    private void updateLink(String workerId, UnaryOperator<PaneStateVector> change) {
        if (!"system".equals(workerId)) {
            update(workerId, change);
            return;
        }
        for (String id : new ArrayList<>(workers.keySet())) {
            update(id, change);
        }
    }

    private void advanceFromStream(Event event) {
        String requestId = EventJson.text(event.payload(), "requestId");
        WorkerContext ctx = contextOfRequest(requestId);
        WorkerContext.InFlight f = ctx == null ? null : inFlight(ctx, requestId);
        if (f != null) {
            ctx.inFlight().put(f.request().kind().operationClass(), f.advancedTo(event.eventId()));
        }
    }

    private void releaseFromStream(Event event) {
        String requestId = EventJson.text(event.payload(), "requestId");
        WorkerContext ctx = contextOfRequest(requestId);
        WorkerContext.InFlight f = ctx == null ? null : inFlight(ctx, requestId);
        if (f != null) {
            release(ctx, f);
        }
    }

    private void restart(Event event) {
        String workerId = event.workerId();
        WorkerContext ctx = workers.remove(workerId);
        if (ctx == null) {
            return;
        }
        log.info("Worker {} restarted; discarding its state", workerId);

        for (DeferredRequest d : ctx.deferred()) {
            drop(d, WORKER_RESTARTED, d.lastReasons);
        }
        ctx.deferred().clear();

        for (WorkerContext.InFlight f : ctx.inFlight().values()) {
            f.cancelLease();
            workerByRequest.remove(f.request().requestId());
            ObjectNode payload = requestRef(f.request());
            payload.put("reason", WORKER_RESTARTED);
            emit(events.builder(EventTypes.INJECT_FAILED, Stage.VERIFY,
                            TraceContext.of(f.traceId(), f.lastEventId(), workerId))
                    .status(EventStatus.FAILED)
                    .payload(payload)
                    .build());
        }

        WorkerContext.PendingResize pending = ctx.pendingResize();
        if (pending != null) {
            ObjectNode payload = requestRef(pending.request());
            payload.put("reason", WORKER_RESTARTED);
            payload.putArray("reasons");
            emit(events.builder(EventTypes.INJECT_DROPPED, Stage.ROUTE,
                            TraceContext.of(pending.traceId(), pending.lastEventId(), workerId))
                    .status(EventStatus.DROPPED)
                    .payload(payload)
                    .build());
        }
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public synchronized PaneStateVector state(String workerId) {
        WorkerContext ctx = workers.get(workerId);
        return ctx != null ? ctx.state() : initialState();
    }

    public synchronized int deferredCount(String workerId) {
        WorkerContext ctx = workers.get(workerId);
        return ctx != null ? ctx.deferredCount() : 0;
    }

    public synchronized boolean isInFlight(String requestId) {
        return workerByRequest.containsKey(requestId);
    }

    /**
     * Cancel timers. Deferred requests stay queued in memory.
     */
    public synchronized void close() {
        for (WorkerContext ctx : workers.values()) {
            ctx.deferred().forEach(PaneContractEngine::cancelTimer);
            ctx.inFlight().values().forEach(WorkerContext.InFlight::cancelLease);
        }
        if (safeModeExit != null) {
            safeModeExit.cancel();
            safeModeExit = null;
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private WorkerContext context(String workerId) {
        return workers.computeIfAbsent(workerId, id -> new WorkerContext(id, initialState()));
    }

    private PaneStateVector initialState() {
        return PaneStateVector.initial().withSafeMode(safeMode);
    }

    private WorkerContext contextOfRequest(String requestId) {
        if (requestId == null) {
            return null;
        }
        String workerId = workerByRequest.get(requestId);
        return workerId == null ? null : workers.get(workerId);
    }

    private static WorkerContext.InFlight inFlight(WorkerContext ctx, String requestId) {
        for (WorkerContext.InFlight f : ctx.inFlight().values()) {
            if (f.request().requestId().equals(requestId)) {
                return f;
            }
        }
        return null;
    }

    private static ObjectNode requestRef(InjectionRequest request) {
        ObjectNode payload = EventJson.objectNode();
        payload.put("requestId", request.requestId());
        payload.put("intent", request.kind().wireName());
        return payload;
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private Event emit(Event event) {
        sink.emit(event);
        return event;
    }

    private void report(InjectionRequest request, String decision, List<String> reasons) {
        observabilitySink.onContractDecision(new ContractDecisionEvent(
                events.wallClock().now(), request.workerId(), request.requestId(), decision, reasons));
    }
}
