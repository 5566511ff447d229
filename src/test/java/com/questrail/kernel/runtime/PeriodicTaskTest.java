package com.questrail.kernel.runtime;

import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.RecordingObservabilitySink;
import com.questrail.kernel.time.DeterministicScheduler;
import com.questrail.kernel.time.ManualMonotonicClock;
import com.questrail.kernel.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PeriodicTaskTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink obs = new RecordingObservabilitySink();

    private PeriodicTask start(Runnable body) {
        return PeriodicTask.start("test", Duration.ofMillis(100), scheduler, clock, new ManualWallClock(0), obs, body);
    }

    @Test
    void runsOncePerInterval() {
        AtomicInteger runs = new AtomicInteger();
        start(runs::incrementAndGet);

        for (int i = 0; i < 5; i++) {
            clock.advanceMillis(100);
            scheduler.runDueTasks();
        }
        assertEquals(5, runs.get());
    }

    @Test
    void failingRunIsReportedAndTheTaskKeepsGoing() {
        AtomicInteger runs = new AtomicInteger();
        start(() -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertEquals(2, runs.get());
        KernelErrorEvent error = obs.eventsOfType(KernelErrorEvent.class).get(0);
        assertEquals("test failed", error.message());
    }

    @Test
    void cancelStopsFurtherRuns() {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTask task = start(runs::incrementAndGet);

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        task.cancel();
        clock.advanceMillis(500);
        scheduler.runDueTasks();

        assertEquals(1, runs.get());
        assertEquals(0, scheduler.pending());
    }
}
