package com.busylight.diagnostics;

import com.busylight.debounce.DebounceSnapshot;
import com.busylight.debounce.Transition;
import com.busylight.probe.Reading;
import com.busylight.source.SourceId;

import java.time.Duration;

/**
 * Observes sampling without influencing it. Implementations must not throw.
 */
public interface DiagnosticSink {

    DiagnosticSink NOOP = new DiagnosticSink() {
    };

    default void readingObserved(SourceId source, Reading reading, DebounceSnapshot state) {
    }

    default void transition(SourceId source, Transition transition) {
    }

    default void sampleTimedOut(SourceId source, Duration deadline) {
    }

    default void sampleFailed(SourceId source, Throwable error) {
    }

    default void tickDropped(SourceId source) {
    }

    default void staleReadingDiscarded(SourceId source, Reading reading) {
    }
}
