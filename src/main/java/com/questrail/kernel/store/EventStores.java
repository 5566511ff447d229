package com.questrail.kernel.store;

import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.observability.NullObservabilitySink;
import com.questrail.kernel.observability.StoreObservabilityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Opens the ledger backend.
 *
 * <p>The durable H2 store is preferred. When it cannot be opened, or durability is
 * switched off, an in-memory store is returned instead and the reason is logged
 * once and reported through {@link StoreStatus#degradedReason()}. Opening never
 * fails.</p>
 */
public final class EventStores {
    private static final Logger log = LoggerFactory.getLogger(EventStores.class);

    static final String DURABILITY_DISABLED = "durability disabled by configuration";

    private EventStores() {}

    public static EventStore open(boolean durable,
                                  String url,
                                  RetentionPolicy retention,
                                  Duration busyTimeout,
                                  KernelObservabilitySink sink)
    {
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(busyTimeout, "busyTimeout");
        KernelObservabilitySink obs = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);

        String reason;
        if (!durable) {
            reason = DURABILITY_DISABLED;
        } else {
            try {
                return JdbcEventStore.open(url, null, null, retention, busyTimeout);
            } catch (LedgerStorageException e) {
                reason = "durable ledger unavailable: " + rootMessage(e);
                log.warn("Evidence ledger at {} could not be opened; continuing in memory", url, e);
            }
        }

        if (!durable) {
            log.warn("Evidence ledger is not durable: {}", reason);
        }
        obs.onStoreEvent(new StoreObservabilityEvent(Instant.now(), "degraded", reason));
        return new InMemoryEventStore(retention, busyTimeout, reason);
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
