package com.busylight.lifecycle;

import com.busylight.config.ProbeConfig;
import com.busylight.config.SourceConfig;
import com.busylight.diagnostics.LoggingDiagnosticSink;
import com.busylight.probe.CommandProbe;
import com.busylight.probe.PatternClassifier;
import com.busylight.probe.Precheck;
import com.busylight.probe.Probe;
import com.busylight.probe.ProcessRunningPrecheck;
import com.busylight.probe.ThresholdClassifier;
import com.busylight.runner.SourceOptions;
import com.busylight.win32.Win32WindowTitleProbe;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a configured source into the probe and options a runner needs.
 */
public class SourceFactory {

    public Probe createProbe(SourceConfig source) {
        Objects.requireNonNull(source, "source");
        ProbeConfig probe = source.probe();
        return switch (probe.type()) {
            case COMMAND_PATTERN -> new CommandProbe(probe.command(),
                    PatternClassifier.ofRegex(probe.patterns(), probe.lineCount()));
            case COMMAND_THRESHOLD -> new CommandProbe(probe.command(),
                    new ThresholdClassifier(Pattern.compile(probe.valuePattern()),
                            probe.low(), probe.high(), probe.percentAsProgress()));
            case WINDOW_TITLE -> new Win32WindowTitleProbe(probe.keywords());
        };
    }

    public SourceOptions createOptions(SourceConfig source) {
        Objects.requireNonNull(source, "source");
        Precheck precheck = source.requiresProcess() == null
                ? Precheck.ALWAYS
                : new ProcessRunningPrecheck(source.requiresProcess());
        return SourceOptions.defaults()
                .withDeadline(source.timeout())
                .withIdleThrottle(source.idleThrottle())
                .withPrecheck(precheck)
                .withDiagnostics(new LoggingDiagnosticSink(source.verbose()));
    }
}
