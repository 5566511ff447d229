package com.questrail.kernel.store;

import com.questrail.kernel.observability.RecordingObservabilitySink;
import com.questrail.kernel.observability.StoreObservabilityEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Opening the ledger never fails; an unusable durable store degrades to memory
 * and says so.
 */
class EventStoresTest {

    @Test
    void durableStoreOpensWhenAvailable() {
        String url = "jdbc:h2:mem:stores-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        try (EventStore store = EventStores.open(true, url, RetentionPolicy.defaults(), Duration.ofSeconds(1), null)) {
            assertInstanceOf(JdbcEventStore.class, store);
            assertTrue(store.status().durable());
        }
    }

    @Test
    void unusableUrlDegradesToMemory() {
        RecordingObservabilitySink obs = new RecordingObservabilitySink();

        try (EventStore store = EventStores.open(true, "jdbc:nope:nowhere", RetentionPolicy.defaults(),
                Duration.ofSeconds(1), obs)) {
            assertInstanceOf(InMemoryEventStore.class, store);
            StoreStatus status = store.status();
            assertFalse(status.durable());
            assertTrue(status.degradedReason().startsWith("durable ledger unavailable"));
        }

        List<StoreObservabilityEvent> events = obs.eventsOfType(StoreObservabilityEvent.class);
        assertEquals(1, events.size());
        assertEquals("degraded", events.get(0).kind());
    }

    @Test
    void durabilityCanBeSwitchedOff() {
        try (EventStore store = EventStores.open(false, null, RetentionPolicy.defaults(), Duration.ofSeconds(1), null)) {
            assertEquals(EventStores.DURABILITY_DISABLED, store.status().degradedReason());
        }
    }
}
