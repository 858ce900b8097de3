package com.busylight.schedule;

import com.busylight.debounce.DebounceConfig;
import com.busylight.debounce.DebounceSnapshot;
import com.busylight.probe.Probe;
import com.busylight.runner.RunnerContext;
import com.busylight.runner.SourceEventListener;
import com.busylight.runner.SourceOptions;
import com.busylight.runner.SourceRunner;
import com.busylight.source.SourceId;
import com.busylight.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-rate ticker that polls every registered source once per tick.
 *
 * <p>Polling never waits for probes, so the tick rate is independent of how long any
 * probe takes.
 */
public class PollScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);

    private final Map<SourceId, SourceRunner> runners = new ConcurrentHashMap<>();
    private final Map<SourceId, SourceRunner> retired = new ConcurrentHashMap<>();
    private final RunnerContext context;
    private final ScheduledExecutorService ticker;
    private final ScheduledExecutorService watchdog;
    private final Object tickLock = new Object();

    private boolean ticking;
    private Duration tickInterval;
    private ScheduledFuture<?> tickTask;
    private boolean closed;

    public PollScheduler(Duration tickInterval, Executor publisher, SourceEventListener listener) {
        this.tickInterval = validInterval(tickInterval);
        this.ticker = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("ticker"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("watchdog"));
        this.context = new RunnerContext(publisher, watchdog, listener);
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        if (tickTask != null) {
            return;
        }
        synchronized (tickLock) {
            ticking = true;
        }
        long periodMillis = tickInterval.toMillis();
        tickTask = ticker.scheduleAtFixedRate(
                () -> safeExecute(this::scheduledTick, "poll tick"),
                0,
                periodMillis,
                TimeUnit.MILLISECONDS
        );
        log.info("Polling {} source(s) every {} ms", runners.size(), periodMillis);
    }

    /**
     * Stops ticking. Registered sources and their state are kept. Once this returns no
     * scheduled tick polls any source.
     */
    public synchronized void stop() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        synchronized (tickLock) {
            ticking = false;
        }
    }

    public synchronized boolean isRunning() {
        return tickTask != null;
    }

    public synchronized void reschedule(Duration interval) {
        Duration validated = validInterval(interval);
        if (validated.equals(tickInterval)) {
            return;
        }
        tickInterval = validated;
        if (tickTask != null) {
            stop();
            start();
        }
    }

    public synchronized Duration tickInterval() {
        return tickInterval;
    }

    private void scheduledTick() {
        synchronized (tickLock) {
            if (ticking) {
                pollAll();
            }
        }
    }

    /**
     * Polls every registered source once. Returns immediately.
     */
    public void tick() {
        synchronized (tickLock) {
            pollAll();
        }
    }

    private void pollAll() {
        for (SourceRunner runner : runners.values()) {
            try {
                runner.poll();
            } catch (IllegalStateException ex) {
                if (runner.isClosed()) {
                    log.debug("Skipped {} removed during tick", runner.id());
                } else {
                    log.error("Polling {} failed", runner.id(), ex);
                }
            }
        }
    }

    public synchronized void addSource(SourceId id, DebounceConfig debounce, Probe probe, SourceOptions options) {
        Objects.requireNonNull(id, "id");
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        if (runners.containsKey(id)) {
            throw new IllegalStateException("Source " + id + " is already registered");
        }
        SourceRunner runner = new SourceRunner(id, debounce, probe, options, context);
        SourceRunner previous = retired.remove(id);
        if (previous != null && !previous.isDrained()) {
            runner.setPredecessor(previous);
        }
        runners.put(id, runner);
        log.info("Source {} enabled (show after {}, hide after {})", id,
                debounce.requiredConsecutiveToActivate(), debounce.requiredConsecutiveToDeactivate());
    }

    public synchronized void removeSource(SourceId id) {
        Objects.requireNonNull(id, "id");
        SourceRunner runner = runners.remove(id);
        if (runner == null) {
            throw new IllegalStateException("Source " + id + " is not registered");
        }
        runner.close();
        retired.put(id, runner);
        retired.values().removeIf(SourceRunner::isDrained);
        log.info("Source {} disabled", id);
    }

    /**
     * Hard reset of one source, as if it had been toggled off and on.
     */
    public void resetSource(SourceId id) {
        SourceRunner runner = runners.get(id);
        if (runner == null) {
            throw new IllegalStateException("Source " + id + " is not registered");
        }
        runner.reset();
    }

    public void resetAll() {
        runners.values().forEach(SourceRunner::reset);
    }

    public boolean contains(SourceId id) {
        return runners.containsKey(id);
    }

    public Set<SourceId> sources() {
        return new TreeSet<>(runners.keySet());
    }

    public Optional<DebounceSnapshot> snapshot(SourceId id) {
        return Optional.ofNullable(runners.get(id)).map(SourceRunner::snapshot);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            stop();
        }
        ticker.shutdownNow();
        runners.values().forEach(SourceRunner::close);
        runners.clear();
        retired.clear();
        watchdog.shutdownNow();
    }

    private void safeExecute(Runnable runnable, String taskName) {
        try {
            runnable.run();
        } catch (Throwable ex) {
            log.error("Error executing {}", taskName, ex);
        }
    }

    private static Duration validInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.toMillis() < 1) {
            throw new IllegalArgumentException("tick interval must be at least 1 ms: " + interval);
        }
        return interval;
    }
}
