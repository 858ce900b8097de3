package com.busylight.runner;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Infrastructure shared by all runners of one scheduler.
 *
 * @param publisher single-threaded executor that owns all debounce and aggregate state
 * @param watchdog  schedules sample deadlines; its tasks never block
 * @param listener  receives readings and transitions on the publisher
 */
public record RunnerContext(
        Executor publisher,
        ScheduledExecutorService watchdog,
        SourceEventListener listener
) {

    public RunnerContext {
        Objects.requireNonNull(publisher, "publisher");
        Objects.requireNonNull(watchdog, "watchdog");
        Objects.requireNonNull(listener, "listener");
    }
}
