package com.busylight.probe;

import java.util.Objects;

public record CommandOutput(int exitCode, String stdout) {

    public CommandOutput {
        Objects.requireNonNull(stdout, "stdout");
    }
}
