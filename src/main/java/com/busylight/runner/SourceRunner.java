package com.busylight.runner;

import com.busylight.debounce.DebounceConfig;
import com.busylight.debounce.DebounceSnapshot;
import com.busylight.debounce.DebounceStateMachine;
import com.busylight.debounce.Transition;
import com.busylight.diagnostics.DiagnosticSink;
import com.busylight.probe.Probe;
import com.busylight.probe.ProbeTimeoutException;
import com.busylight.probe.Reading;
import com.busylight.source.SourceId;
import com.busylight.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one probe on its own single-thread lane and debounces its readings.
 *
 * <p>{@link #poll()} never blocks: it drops the tick while a sample is outstanding, otherwise
 * it hands one sample to the lane. Each dispatched sample resolves exactly once, either with
 * the probe's reading or, when the deadline passes first, with a synthetic inactive reading.
 * A probe that ignores the interrupt keeps the lane busy past its deadline; ticks are dropped
 * until the probe call returns, so the lane never queues samples behind it.
 * Readings are applied on the publisher; readings sampled before the latest {@link #reset()}
 * are discarded.
 */
public class SourceRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceRunner.class);

    private final SourceId id;
    private final Probe probe;
    private final SourceOptions options;
    private final DiagnosticSink diagnostics;
    private final RunnerContext context;
    private final DebounceStateMachine stateMachine;
    private final ExecutorService lane;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicBoolean laneBusy = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong pollCount = new AtomicLong();

    private final long createdNanos = System.nanoTime();

    private volatile SourceRunner predecessor;
    private volatile boolean predecessorWarned;

    public SourceRunner(SourceId id,
                        DebounceConfig debounce,
                        Probe probe,
                        SourceOptions options,
                        RunnerContext context) {
        this.id = Objects.requireNonNull(id, "id");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.options = Objects.requireNonNull(options, "options");
        this.context = Objects.requireNonNull(context, "context");
        this.diagnostics = options.diagnostics();
        this.stateMachine = new DebounceStateMachine(debounce);
        this.lane = Executors.newSingleThreadExecutor(new NamedThreadFactory("probe-" + id.value()));
    }

    /**
     * Makes this runner skip ticks until {@code retired}, an earlier runner for the same
     * source, has finished its last sample.
     *
     * <p>The wait has no time limit. A retired probe that never returns from its last call
     * keeps this source silent; each dropped tick is reported to the diagnostics sink and a
     * warning is logged once the wait exceeds the sample deadline.
     */
    public void setPredecessor(SourceRunner retired) {
        this.predecessor = retired;
    }

    public void poll() {
        if (closed.get()) {
            throw new IllegalStateException("Source " + id + " has been removed");
        }
        SourceRunner previous = predecessor;
        if (previous != null) {
            if (!previous.isDrained()) {
                warnIfPredecessorStuck(previous);
                diagnostics.tickDropped(id);
                return;
            }
            predecessor = null;
        }
        if (inFlight.get() || laneBusy.get()) {
            diagnostics.tickDropped(id);
            return;
        }
        long count = pollCount.incrementAndGet();
        if (!stateMachine.isActive() && count % options.idleThrottle() != 0) {
            return;
        }
        if (!inFlight.compareAndSet(false, true)) {
            diagnostics.tickDropped(id);
            return;
        }
        laneBusy.set(true);
        dispatch();
    }

    private void warnIfPredecessorStuck(SourceRunner previous) {
        Optional<Duration> deadline = options.deadline();
        if (deadline.isEmpty() || predecessorWarned) {
            return;
        }
        long waitingMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - createdNanos);
        if (waitingMillis > deadline.get().toMillis()) {
            predecessorWarned = true;
            log.warn("Source {} still waits for its previous probe call after {} ms", previous.id(), waitingMillis);
        }
    }

    private void dispatch() {
        SampleAttempt attempt = new SampleAttempt(generation.get());
        Future<?> future;
        try {
            future = lane.submit(() -> runSample(attempt));
        } catch (RejectedExecutionException ex) {
            laneBusy.set(false);
            inFlight.set(false);
            throw new IllegalStateException("Source " + id + " has been removed", ex);
        }
        Optional<Duration> deadline = options.deadline();
        if (deadline.isPresent()) {
            Duration limit = deadline.get();
            try {
                ScheduledFuture<?> timer = context.watchdog().schedule(
                        () -> onDeadline(attempt, future, limit),
                        limit.toMillis(),
                        TimeUnit.MILLISECONDS);
                attempt.attachTimer(timer);
            } catch (RejectedExecutionException ex) {
                log.debug("Watchdog stopped; {} sample runs without deadline", id);
            }
        }
    }

    private void runSample(SampleAttempt attempt) {
        if (!attempt.claimLane()) {
            return;
        }
        try {
            sample(attempt);
        } finally {
            laneBusy.set(false);
        }
    }

    private void sample(SampleAttempt attempt) {
        Reading reading;
        try {
            if (!options.precheck().passes()) {
                reading = Reading.inactive("precheck failed");
            } else {
                reading = Objects.requireNonNull(probe.sample(options.probeTimeout()), "probe returned null");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            reading = Reading.inactive("interrupted");
        } catch (ProbeTimeoutException ex) {
            if (!attempt.isResolved()) {
                diagnostics.sampleTimedOut(id, ex.timeout());
            }
            reading = Reading.inactive("timed out after " + ex.timeout().toMillis() + " ms");
        } catch (Exception | LinkageError ex) {
            if (!attempt.isResolved()) {
                diagnostics.sampleFailed(id, ex);
            }
            reading = Reading.inactive(ex.getClass().getSimpleName());
        }
        if (attempt.tryResolve()) {
            complete(attempt, reading);
        }
    }

    private void onDeadline(SampleAttempt attempt, Future<?> future, Duration deadline) {
        if (!attempt.tryResolve()) {
            return;
        }
        future.cancel(true);
        if (attempt.abandonLane()) {
            // never started on the lane
            laneBusy.set(false);
        }
        diagnostics.sampleTimedOut(id, deadline);
        complete(attempt, Reading.inactive("timed out after " + deadline.toMillis() + " ms"));
    }

    private void complete(SampleAttempt attempt, Reading reading) {
        try {
            publish(() -> apply(attempt.generation, reading));
        } finally {
            inFlight.set(false);
        }
    }

    private void apply(long sampledGeneration, Reading reading) {
        if (sampledGeneration != generation.get() || closed.get()) {
            diagnostics.staleReadingDiscarded(id, reading);
            return;
        }
        Optional<Transition> transition = stateMachine.update(reading.activity());
        diagnostics.readingObserved(id, reading, stateMachine.snapshot());
        context.listener().onReading(id, reading);
        transition.ifPresent(this::emit);
    }

    /**
     * Forces the debounce state back to {@code {0, 0, false}}. Samples already in flight
     * still finish but their readings are dropped.
     */
    public void reset() {
        generation.incrementAndGet();
        pollCount.set(0);
        publish(this::applyReset);
    }

    private void applyReset() {
        Optional<Transition> transition = stateMachine.reset();
        transition.ifPresent(this::emit);
        context.listener().onReset(id);
    }

    private void emit(Transition transition) {
        diagnostics.transition(id, transition);
        context.listener().onTransition(id, transition);
    }

    private void publish(Runnable task) {
        try {
            context.publisher().execute(() -> {
                try {
                    task.run();
                } catch (Throwable ex) {
                    log.error("Error publishing state for {}", id, ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Publisher stopped; dropping update for {}", id);
        }
    }

    public SourceId id() {
        return id;
    }

    public DebounceSnapshot snapshot() {
        return stateMachine.snapshot();
    }

    public boolean isActive() {
        return stateMachine.isActive();
    }

    /**
     * True while a sample is unresolved or its probe call has not yet returned.
     */
    public boolean isSampleInFlight() {
        return inFlight.get() || laneBusy.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * True once the runner is closed and its lane has finished every sample.
     */
    public boolean isDrained() {
        return closed.get() && lane.isTerminated();
    }

    /**
     * Resets state and retires the lane. An in-flight sample may finish; its result is discarded.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        reset();
        try {
            lane.execute(this::closeProbe);
        } catch (RejectedExecutionException ex) {
            closeProbe();
        }
        lane.shutdown();
    }

    private void closeProbe() {
        try {
            probe.close();
        } catch (Exception ex) {
            log.debug("Error closing probe for {}", id, ex);
        }
    }

    private static final class SampleAttempt {
        private final long generation;
        private final AtomicBoolean resolved = new AtomicBoolean(false);
        private final AtomicBoolean laneDecided = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> timer;

        private SampleAttempt(long generation) {
            this.generation = generation;
        }

        private boolean tryResolve() {
            if (!resolved.compareAndSet(false, true)) {
                return false;
            }
            ScheduledFuture<?> pending = timer;
            if (pending != null) {
                pending.cancel(false);
            }
            return true;
        }

        private boolean claimLane() {
            return laneDecided.compareAndSet(false, true);
        }

        private boolean abandonLane() {
            return laneDecided.compareAndSet(false, true);
        }

        private boolean isResolved() {
            return resolved.get();
        }

        private void attachTimer(ScheduledFuture<?> scheduled) {
            this.timer = scheduled;
            if (resolved.get()) {
                scheduled.cancel(false);
            }
        }
    }
}
