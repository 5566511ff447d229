package com.questrail.kernel.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class InMemoryEventStoreTest extends EventStoreContractTest {

    @Override
    protected EventStore createStore(RetentionPolicy retention) {
        return new InMemoryEventStore(retention, Duration.ofSeconds(1), null);
    }

    @Test
    void reportsItselfAsNotDurable() {
        StoreStatus status = store.status();
        assertFalse(status.durable());
        assertEquals("memory", status.backend());
    }
}
