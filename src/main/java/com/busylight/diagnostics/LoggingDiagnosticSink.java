package com.busylight.diagnostics;

import com.busylight.debounce.DebounceSnapshot;
import com.busylight.debounce.Transition;
import com.busylight.probe.Reading;
import com.busylight.source.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Writes diagnostics to SLF4J with the source id in the {@code source} MDC key.
 *
 * <p>Raw readings go to DEBUG, or INFO when the source is configured as verbose.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    public static final String MDC_SOURCE_KEY = "source";

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    private final boolean verbose;

    public LoggingDiagnosticSink(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void readingObserved(SourceId source, Reading reading, DebounceSnapshot state) {
        if (!verbose && !log.isDebugEnabled()) {
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
            String detail = reading.detail().orElse("-");
            if (verbose) {
                log.info("{} reading={} streak={}/{} visible={} ({})",
                        source, reading.activity(), state.consecutiveActiveReadings(),
                        state.consecutiveInactiveReadings(), state.active(), detail);
            } else {
                log.debug("{} reading={} streak={}/{} visible={} ({})",
                        source, reading.activity(), state.consecutiveActiveReadings(),
                        state.consecutiveInactiveReadings(), state.active(), detail);
            }
        }
    }

    @Override
    public void transition(SourceId source, Transition transition) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
            if (transition.active()) {
                log.info("{} became active", source);
            } else {
                log.info("{} became inactive", source);
            }
        }
    }

    @Override
    public void sampleTimedOut(SourceId source, Duration deadline) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
            log.warn("{} probe did not answer within {} ms; cancelled and counted as inactive",
                    source, deadline.toMillis());
        }
    }

    @Override
    public void sampleFailed(SourceId source, Throwable error) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
            if (verbose) {
                log.info("{} probe failed, counted as inactive", source, error);
            } else {
                log.debug("{} probe failed, counted as inactive: {}", source, error.toString());
            }
        }
    }

    @Override
    public void tickDropped(SourceId source) {
        if (log.isTraceEnabled()) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
                log.trace("{} still sampling, tick dropped", source);
            }
        }
    }

    @Override
    public void staleReadingDiscarded(SourceId source, Reading reading) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE_KEY, source.value())) {
            log.debug("{} discarded {} reading sampled before reset", source, reading.activity());
        }
    }
}
