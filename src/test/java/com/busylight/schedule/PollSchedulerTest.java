package com.busylight.schedule;

import com.busylight.aggregate.ActivityAggregator;
import com.busylight.debounce.DebounceConfig;
import com.busylight.debounce.DebounceSnapshot;
import com.busylight.probe.Activity;
import com.busylight.runner.SourceOptions;
import com.busylight.source.SourceId;
import com.busylight.testing.RecordingDiagnosticSink;
import com.busylight.testing.ScriptedProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.busylight.testing.Conditions.await;
import static com.busylight.testing.Conditions.drain;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollSchedulerTest {

    private static final SourceId XCODE = SourceId.of("xcode");
    private static final SourceId GRADLE = SourceId.of("gradle");

    private final ExecutorService publisher = Executors.newSingleThreadExecutor();
    private final ActivityAggregator aggregator = new ActivityAggregator();
    private final PollScheduler scheduler = new PollScheduler(Duration.ofHours(1), publisher, aggregator);

    @AfterEach
    void tearDown() {
        scheduler.close();
        publisher.shutdownNow();
    }

    @Test
    void shouldPollEveryRegisteredSourceOnTick() throws Exception {
        ScriptedProbe xcode = ScriptedProbe.answering(Activity.ACTIVE);
        ScriptedProbe gradle = ScriptedProbe.answering(Activity.INACTIVE);
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), xcode, SourceOptions.defaults());
        scheduler.addSource(GRADLE, DebounceConfig.of(1, 3), gradle, SourceOptions.defaults());

        scheduler.tick();

        await("xcode active", () -> aggregator.activeSet().contains(XCODE));
        await("gradle sampled", () -> aggregator.lastReading(GRADLE).isPresent());
        drain(publisher);
        assertEquals(Set.of(XCODE), aggregator.activeSet());
        assertEquals(1, gradle.invocations());
        assertEquals(Set.of(GRADLE, XCODE), scheduler.sources());
    }

    @Test
    void shouldReturnFromTickWhileProbeIsHung() throws Exception {
        ScriptedProbe hung = ScriptedProbe.answering(Activity.ACTIVE).blocking();
        ScriptedProbe healthy = ScriptedProbe.answering(Activity.ACTIVE);
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), hung, SourceOptions.withoutDeadline());
        scheduler.addSource(GRADLE, DebounceConfig.of(1, 3), healthy, SourceOptions.withoutDeadline());

        long started = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            scheduler.tick();
            await("healthy sampled", () -> aggregator.lastReading(GRADLE).isPresent());
        }
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
        drain(publisher);

        assertTrue(elapsedMillis < 5_000);
        assertEquals(1, hung.invocations());
        assertEquals(Set.of(GRADLE), aggregator.activeSet());
        hung.release();
    }

    @Test
    void shouldTickOnItsOwnOnceStarted() throws Exception {
        try (PollScheduler fast = new PollScheduler(Duration.ofMillis(20), publisher, aggregator)) {
            ScriptedProbe probe = ScriptedProbe.answering(Activity.INACTIVE);
            fast.addSource(XCODE, DebounceConfig.defaults(), probe, SourceOptions.defaults());

            fast.start();
            assertTrue(fast.isRunning());
            await("several ticks", () -> probe.invocations() >= 3);

            fast.stop();
            assertFalse(fast.isRunning());
            fast.reschedule(Duration.ofMillis(50));
            assertEquals(Duration.ofMillis(50), fast.tickInterval());
        }
    }

    @Test
    void shouldRejectDuplicateAndUnknownSources() {
        scheduler.addSource(XCODE, DebounceConfig.defaults(), ScriptedProbe.answering(Activity.ACTIVE),
                SourceOptions.defaults());

        assertThrows(IllegalStateException.class, () -> scheduler.addSource(XCODE, DebounceConfig.defaults(),
                ScriptedProbe.answering(Activity.ACTIVE), SourceOptions.defaults()));
        assertThrows(IllegalStateException.class, () -> scheduler.removeSource(GRADLE));
        assertThrows(IllegalStateException.class, () -> scheduler.resetSource(GRADLE));
        assertThrows(IllegalArgumentException.class, () -> scheduler.reschedule(Duration.ZERO));
    }

    @Test
    void shouldDropSourceFromActiveSetWhenRemoved() throws Exception {
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), ScriptedProbe.answering(Activity.ACTIVE),
                SourceOptions.defaults());
        scheduler.tick();
        await("xcode active", () -> aggregator.activeSet().contains(XCODE));

        scheduler.removeSource(XCODE);
        drain(publisher);

        assertTrue(aggregator.activeSet().isEmpty());
        assertFalse(scheduler.contains(XCODE));
    }

    @Test
    void shouldIgnoreInFlightResultWhenSourceIsDisabledAndReenabled() throws Exception {
        ScriptedProbe stale = ScriptedProbe.answering(Activity.ACTIVE).blocking();
        RecordingDiagnosticSink oldDiagnostics = new RecordingDiagnosticSink();
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), stale,
                SourceOptions.withoutDeadline().withDiagnostics(oldDiagnostics));
        scheduler.tick();
        assertTrue(stale.awaitEntered(5_000));

        scheduler.removeSource(XCODE);
        ScriptedProbe fresh = ScriptedProbe.answering(Activity.INACTIVE);
        RecordingDiagnosticSink newDiagnostics = new RecordingDiagnosticSink();
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), fresh,
                SourceOptions.withoutDeadline().withDiagnostics(newDiagnostics));

        // the predecessor still holds its sample, so the new runner must not start another
        scheduler.tick();
        assertEquals(0, fresh.invocations());
        assertEquals(1, newDiagnostics.droppedTicks.get());

        stale.release();
        await("stale reading discarded", () -> oldDiagnostics.staleReadings.size() == 1);
        await("old probe closed", stale::isClosed);
        drain(publisher);
        assertEquals(DebounceSnapshot.INITIAL, scheduler.snapshot(XCODE).orElseThrow());
        assertTrue(aggregator.activeSet().isEmpty());

        await("fresh runner sampling", () -> {
            scheduler.tick();
            return fresh.invocations() > 0;
        });
        drain(publisher);
        assertTrue(aggregator.activeSet().isEmpty());
        assertEquals(1, stale.maxConcurrent());
    }

    @Test
    void shouldResetAllSources() throws Exception {
        scheduler.addSource(XCODE, DebounceConfig.of(1, 3), ScriptedProbe.answering(Activity.ACTIVE),
                SourceOptions.defaults());
        scheduler.addSource(GRADLE, DebounceConfig.of(1, 3), ScriptedProbe.answering(Activity.ACTIVE),
                SourceOptions.defaults());
        scheduler.tick();
        await("both active", () -> aggregator.activeSet().size() == 2);

        scheduler.resetAll();
        drain(publisher);

        assertTrue(aggregator.activeSet().isEmpty());
        assertEquals(DebounceSnapshot.INITIAL, scheduler.snapshot(GRADLE).orElseThrow());
    }

    @Test
    void shouldRefuseNewSourcesAfterClose() {
        scheduler.close();

        assertThrows(IllegalStateException.class, () -> scheduler.addSource(XCODE, DebounceConfig.defaults(),
                ScriptedProbe.answering(Activity.ACTIVE), SourceOptions.defaults()));
        assertThrows(IllegalStateException.class, scheduler::start);
    }
}
