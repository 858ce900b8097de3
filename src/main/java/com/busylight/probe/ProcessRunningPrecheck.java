package com.busylight.probe;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Passes while a process with the given executable name is running.
 */
public class ProcessRunningPrecheck implements Precheck {

    private final String executableName;

    public ProcessRunningPrecheck(String executableName) {
        if (StringUtils.isBlank(executableName)) {
            throw new IllegalArgumentException("executableName must not be blank");
        }
        this.executableName = normalize(executableName);
    }

    @Override
    public boolean passes() {
        return ProcessHandle.allProcesses()
                .map(handle -> handle.info().command())
                .flatMap(Optional::stream)
                .anyMatch(this::matches);
    }

    boolean matches(String command) {
        Objects.requireNonNull(command, "command");
        Path fileName = Path.of(command).getFileName();
        return fileName != null && normalize(fileName.toString()).equals(executableName);
    }

    private static String normalize(String name) {
        String lower = name.trim().toLowerCase(Locale.ROOT);
        return StringUtils.removeEnd(lower, ".exe");
    }
}
