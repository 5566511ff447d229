package com.questrail.kernel.contract;

import com.questrail.kernel.time.Cancellable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * WorkerContext
 * =============================================================================
 * Everything the contract engine knows about one worker.
 *
 * <ul>
 *   <li>the live {@link PaneStateVector}</li>
 *   <li>the queue of deferred requests, oldest first</li>
 *   <li>which request holds each operation class</li>
 *   <li>the pending (coalesced) resize, if any</li>
 * </ul>
 *
 * Evaluators only read a context. It is mutated by {@link PaneContractEngine}
 * under the engine's lock and discarded when the worker restarts.
 */
public final class WorkerContext {

    /**
     * An applied request that still owns its operation class.
     *
     * @param lastEventId the most recent event recorded for it; the next hop
     *                    is parented here
     * @param lease       expires the ownership if no verdict arrives; may be null
     */
    record InFlight(InjectionRequest request, String traceId, String lastEventId, Cancellable lease) {
        InFlight(InjectionRequest request, String traceId, String lastEventId) {
            this(request, traceId, lastEventId, null);
        }

        InFlight advancedTo(String eventId) {
            return new InFlight(request, traceId, eventId, lease);
        }

        void cancelLease() {
            if (lease != null) {
                lease.cancel();
            }
        }
    }

    /**
     * A resize waiting for the current injection to end.
     */
    record PendingResize(InjectionRequest request, String traceId, String lastEventId, int superseded) {}

    private final String workerId;
    private PaneStateVector state;
    private final Deque<DeferredRequest> deferred = new ArrayDeque<>();
    private final Map<String, InFlight> inFlightByClass = new HashMap<>();
    private PendingResize pendingResize;

    WorkerContext(String workerId, PaneStateVector initial) {
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.state = Objects.requireNonNull(initial, "initial");
    }

    public String workerId() {
        return workerId;
    }

    public PaneStateVector state() {
        return state;
    }

    /**
     * Request id currently holding {@code operationClass}.
     */
    public Optional<String> holderOf(String operationClass) {
        InFlight f = inFlightByClass.get(operationClass);
        return f == null ? Optional.empty() : Optional.of(f.request().requestId());
    }

    public int deferredCount() {
        return deferred.size();
    }

    // ---------------------------------------------------------------------
    // Engine-side mutation
    // ---------------------------------------------------------------------

    /**
     * @return {@code true} if the vector changed
     */
    boolean updateState(PaneStateVector next) {
        if (next.equals(state)) {
            return false;
        }
        state = next;
        return true;
    }

    Deque<DeferredRequest> deferred() {
        return deferred;
    }

    Map<String, InFlight> inFlight() {
        return inFlightByClass;
    }

    PendingResize pendingResize() {
        return pendingResize;
    }

    void pendingResize(PendingResize pending) {
        this.pendingResize = pending;
    }
}
