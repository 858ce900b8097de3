package com.busylight.testing;

import com.busylight.debounce.DebounceSnapshot;
import com.busylight.debounce.Transition;
import com.busylight.diagnostics.DiagnosticSink;
import com.busylight.probe.Reading;
import com.busylight.source.SourceId;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

public class RecordingDiagnosticSink implements DiagnosticSink {

    public final List<Reading> readings = new CopyOnWriteArrayList<>();
    public final List<Transition> transitions = new CopyOnWriteArrayList<>();
    public final List<Throwable> failures = new CopyOnWriteArrayList<>();
    public final List<Reading> staleReadings = new CopyOnWriteArrayList<>();
    public final AtomicInteger timeouts = new AtomicInteger();
    public final AtomicInteger droppedTicks = new AtomicInteger();

    @Override
    public void readingObserved(SourceId source, Reading reading, DebounceSnapshot state) {
        readings.add(reading);
    }

    @Override
    public void transition(SourceId source, Transition transition) {
        transitions.add(transition);
    }

    @Override
    public void sampleTimedOut(SourceId source, Duration deadline) {
        timeouts.incrementAndGet();
    }

    @Override
    public void sampleFailed(SourceId source, Throwable error) {
        failures.add(error);
    }

    @Override
    public void tickDropped(SourceId source) {
        droppedTicks.incrementAndGet();
    }

    @Override
    public void staleReadingDiscarded(SourceId source, Reading reading) {
        staleReadings.add(reading);
    }
}
