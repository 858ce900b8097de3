package com.busylight.runner;

import com.busylight.debounce.Transition;
import com.busylight.probe.Reading;
import com.busylight.source.SourceId;

/**
 * Receives a runner's output. Every callback arrives on the publishing thread.
 */
public interface SourceEventListener {

    void onTransition(SourceId source, Transition transition);

    default void onReading(SourceId source, Reading reading) {
        // optional
    }

    /**
     * Called after a reset, following the deactivation it emitted if the source was visible.
     */
    default void onReset(SourceId source) {
        // optional
    }
}
