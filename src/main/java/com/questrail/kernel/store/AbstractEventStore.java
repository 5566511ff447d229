package com.questrail.kernel.store;

import com.questrail.kernel.api.Edge;
import com.questrail.kernel.api.EdgeType;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.EventTaxonomy;
import com.questrail.kernel.api.Span;
import com.questrail.kernel.api.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AbstractEventStore
 * =============================================================================
 * Shared write path for every {@link EventStore} backend.
 *
 * <h2>Single writer</h2>
 * Appends and prunes take one fair lock. Acquisition is bounded by the busy
 * timeout; a caller that cannot get the lock in time receives
 * {@link AppendStatus#BUSY} instead of waiting.
 *
 * <h2>Derivation</h2>
 * Edges and the span update for an event are computed here, under the lock, so
 * backends only persist what they are given.
 */
public abstract class AbstractEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractEventStore.class);

    protected final RetentionPolicy retention;

    private final Duration busyTimeout;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong invalid = new AtomicLong();
    private final AtomicLong busy = new AtomicLong();

    protected AbstractEventStore(RetentionPolicy retention, Duration busyTimeout) {
        this.retention = Objects.requireNonNull(retention, "retention");
        this.busyTimeout = Objects.requireNonNull(busyTimeout, "busyTimeout");
        if (busyTimeout.isNegative()) {
            throw new IllegalArgumentException("busyTimeout must be non-negative");
        }
    }

    // ---------------------------------------------------------------------
    // Backend hooks (always called with the write lock held)
    // ---------------------------------------------------------------------

    protected abstract boolean containsEvent(String eventId);

    protected abstract Span findSpan(String spanId);

    /**
     * Persist the event, its edges and the updated span atomically.
     */
    protected abstract void insert(Event event, List<Edge> edges, Span span);

    protected abstract PruneResult pruneOlderThan(long cutoffMillis, long maxRows);

    protected abstract boolean isDurable();

    protected abstract String backendName();

    protected String degradedReason() {
        return null;
    }

    // ---------------------------------------------------------------------
    // EventStore
    // ---------------------------------------------------------------------

    @Override
    public final AppendResult append(Event event) {
        Objects.requireNonNull(event, "event");

        Optional<String> problem = validate(event);
        if (problem.isPresent()) {
            invalid.incrementAndGet();
            return AppendResult.invalid(event.eventId(), problem.get());
        }

        if (!acquire()) {
            busy.incrementAndGet();
            return AppendResult.busy(event.eventId(), "write path busy for more than " + busyTimeout.toMillis() + "ms");
        }
        try {
            if (containsEvent(event.eventId())) {
                duplicates.incrementAndGet();
                log.debug("Duplicate event {} rejected", event.eventId());
                return AppendResult.duplicate(event.eventId());
            }

            Span current = findSpan(event.spanId());
            Span next = current == null ? Span.openedBy(event) : current.withEvent(event);
            insert(event, deriveEdges(event), next);
            return AppendResult.inserted(event.eventId());
        } catch (LedgerStorageException e) {
            log.error("Append of {} failed", event.eventId(), e);
            return AppendResult.failed(event.eventId(), e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public final PruneResult prune(long nowMillis) {
        if (!acquire()) {
            busy.incrementAndGet();
            log.warn("Prune skipped: write path busy");
            return PruneResult.NONE;
        }
        try {
            long cutoff = nowMillis - retention.ttl().toMillis();
            PruneResult result = pruneOlderThan(cutoff, retention.maxRows());
            if (result.eventsRemoved() > 0) {
                log.info("Pruned {} expired and {} over-cap events ({} edges, {} spans)",
                        result.eventsExpired(), result.eventsOverCap(),
                        result.edgesRemoved(), result.spansRemoved());
            }
            return result;
        } catch (LedgerStorageException e) {
            log.error("Prune failed", e);
            return PruneResult.NONE;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public StoreStatus status() {
        return new StoreStatus(
                isDurable(),
                backendName(),
                degradedReason(),
                size(),
                duplicates.get(),
                invalid.get(),
                busy.get());
    }

    public long duplicateCount() {
        return duplicates.get();
    }

    // ---------------------------------------------------------------------
    // Derivation
    // ---------------------------------------------------------------------

    /**
     * Edges declared by {@code e}: its parent link, its acknowledgment target and
     * its retry origin. An acknowledgment without an explicit target
     * acknowledges its parent; an ack-stage timeout is not an acknowledgment.
     */
    static List<Edge> deriveEdges(Event e) {
        Set<Edge> edges = new LinkedHashSet<>();
        if (e.parentEventId() != null) {
            edges.add(new Edge(e.traceId(), e.parentEventId(), e.eventId(), EdgeType.PARENT));
        }
        String ackOf = e.ackOfEventId();
        if (ackOf == null && e.parentEventId() != null
                && ((e.stage() == Stage.ACK && e.status() != EventStatus.TIMEOUT) || e.type().endsWith(".ack"))) {
            ackOf = e.parentEventId();
        }
        if (ackOf != null) {
            edges.add(new Edge(e.traceId(), ackOf, e.eventId(), EdgeType.ACK_OF));
        }
        if (e.retryOfEventId() != null) {
            edges.add(new Edge(e.traceId(), e.retryOfEventId(), e.eventId(), EdgeType.RETRY_OF));
        }
        return List.copyOf(edges);
    }

    private static Optional<String> validate(Event e) {
        if (!EventTaxonomy.isWellFormed(e.type())) {
            return Optional.of("malformed type: " + e.type());
        }
        if (e.timestamp() < 0) {
            return Optional.of("negative timestamp");
        }
        if (e.sequence() < 0) {
            return Optional.of("negative sequence");
        }
        if (e.eventId().equals(e.parentEventId())) {
            return Optional.of("event is its own parent");
        }
        return Optional.empty();
    }

    private boolean acquire() {
        try {
            return writeLock.tryLock(busyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
