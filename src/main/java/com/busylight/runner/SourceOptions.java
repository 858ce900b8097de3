package com.busylight.runner;

import com.busylight.diagnostics.DiagnosticSink;
import com.busylight.probe.Precheck;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-source sampling options.
 *
 * @param deadline     how long one sample may take before it is cancelled; empty for cheap
 *                     in-process probes
 * @param idleThrottle while the source is not active, only every Nth tick samples
 * @param precheck     cheap condition that must hold for the probe to run at all
 * @param diagnostics  where readings and transitions of this source are reported
 */
public record SourceOptions(
        Optional<Duration> deadline,
        int idleThrottle,
        Precheck precheck,
        DiagnosticSink diagnostics
) {

    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(2);
    /**
     * Passed to probes that run without a deadline.
     */
    public static final Duration UNBOUNDED = Duration.ofMillis(Long.MAX_VALUE);

    public SourceOptions {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(precheck, "precheck");
        Objects.requireNonNull(diagnostics, "diagnostics");
        deadline.ifPresent(d -> {
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException("deadline must be positive: " + d);
            }
        });
        if (idleThrottle < 1) {
            throw new IllegalArgumentException("idleThrottle must be >= 1");
        }
    }

    public static SourceOptions defaults() {
        return new SourceOptions(Optional.of(DEFAULT_DEADLINE), 1, Precheck.ALWAYS, DiagnosticSink.NOOP);
    }

    public static SourceOptions withoutDeadline() {
        return new SourceOptions(Optional.empty(), 1, Precheck.ALWAYS, DiagnosticSink.NOOP);
    }

    public SourceOptions withDeadline(Duration value) {
        return new SourceOptions(Optional.ofNullable(value), idleThrottle, precheck, diagnostics);
    }

    public SourceOptions withIdleThrottle(int value) {
        return new SourceOptions(deadline, value, precheck, diagnostics);
    }

    public SourceOptions withPrecheck(Precheck value) {
        return new SourceOptions(deadline, idleThrottle, value, diagnostics);
    }

    public SourceOptions withDiagnostics(DiagnosticSink value) {
        return new SourceOptions(deadline, idleThrottle, precheck, value);
    }

    Duration probeTimeout() {
        return deadline.orElse(UNBOUNDED);
    }
}
