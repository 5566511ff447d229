package com.questrail.kernel.runtime;

import com.questrail.kernel.observability.KernelErrorEvent;
import com.questrail.kernel.observability.KernelObservabilitySink;
import com.questrail.kernel.time.Cancellable;
import com.questrail.kernel.time.MonotonicClock;
import com.questrail.kernel.time.MonotonicScheduler;
import com.questrail.kernel.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Re-arms a one-shot {@link MonotonicScheduler} task at a fixed interval.
 *
 * <p>A failing run is reported to the observability sink and the task is
 * re-armed anyway.</p>
 */
final class PeriodicTask implements Cancellable {

    private final String name;
    private final Duration interval;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final KernelObservabilitySink observabilitySink;
    private final Runnable body;

    private Cancellable next;
    private boolean cancelled;

    private PeriodicTask(String name,
                         Duration interval,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         WallClock wallClock,
                         KernelObservabilitySink observabilitySink,
                         Runnable body)
    {
        this.name = name;
        this.interval = interval;
        this.scheduler = scheduler;
        this.clock = clock;
        this.wallClock = wallClock;
        this.observabilitySink = observabilitySink;
        this.body = body;
    }

    static PeriodicTask start(String name,
                              Duration interval,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              WallClock wallClock,
                              KernelObservabilitySink observabilitySink,
                              Runnable body)
    {
        PeriodicTask task = new PeriodicTask(
                Objects.requireNonNull(name, "name"),
                Objects.requireNonNull(interval, "interval"),
                Objects.requireNonNull(scheduler, "scheduler"),
                Objects.requireNonNull(clock, "clock"),
                Objects.requireNonNull(wallClock, "wallClock"),
                Objects.requireNonNull(observabilitySink, "observabilitySink"),
                Objects.requireNonNull(body, "body"));
        task.arm();
        return task;
    }

    private synchronized void arm() {
        if (!cancelled) {
            next = scheduler.scheduleAfter(interval, clock, this::run);
        }
    }

    private void run() {
        synchronized (this) {
            if (cancelled) {
                return;
            }
        }
        try {
            body.run();
        } catch (RuntimeException e) {
            observabilitySink.onError(new KernelErrorEvent(wallClock.now(), name + " failed", e));
        }
        arm();
    }

    @Override
    public synchronized boolean cancel() {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        if (next != null) {
            next.cancel();
        }
        return true;
    }
}
