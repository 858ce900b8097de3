package com.busylight.probe;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessRunningPrecheckTest {

    @Test
    void shouldMatchExecutableNameIgnoringCaseAndExtension() {
        ProcessRunningPrecheck precheck = new ProcessRunningPrecheck("Gradle");

        assertTrue(precheck.matches("/usr/local/bin/gradle"));
        assertTrue(precheck.matches("C:/Tools/GRADLE.EXE"));
        assertFalse(precheck.matches("/usr/bin/gradlew"));
    }

    @Test
    void shouldPassWhileCurrentJvmIsRunning() {
        Optional<String> command = ProcessHandle.current().info().command();
        if (command.isEmpty()) {
            return;
        }
        String executable = Path.of(command.get()).getFileName().toString();

        assertTrue(new ProcessRunningPrecheck(executable).passes());
    }

    @Test
    void shouldFailForUnknownExecutable() {
        assertFalse(new ProcessRunningPrecheck("no-such-busylight-binary").passes());
    }

    @Test
    void shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessRunningPrecheck("  "));
    }
}
