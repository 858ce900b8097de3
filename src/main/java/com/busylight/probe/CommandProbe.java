package com.busylight.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command and classifies its standard output.
 *
 * <p>Output goes to a temporary file so that waiting for the process stays interruptible
 * and a chatty command cannot stall on a full pipe. The process and its descendants are
 * destroyed when the timeout passes or the sampling thread is interrupted.
 */
public class CommandProbe implements Probe {

    private static final Logger log = LoggerFactory.getLogger(CommandProbe.class);

    private final List<String> command;
    private final OutputClassifier classifier;

    public CommandProbe(List<String> command, OutputClassifier classifier) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public Reading sample(Duration timeout) throws ProbeException, InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        Path outputFile = createOutputFile();
        try {
            Process process = start(outputFile);
            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    destroyTree(process);
                    throw new ProbeTimeoutException(command.get(0) + " did not exit within "
                            + timeout.toMillis() + " ms", timeout);
                }
            } catch (InterruptedException ex) {
                destroyTree(process);
                throw ex;
            }
            String stdout = Files.readString(outputFile, StandardCharsets.UTF_8);
            return classifier.classify(new CommandOutput(process.exitValue(), stdout));
        } catch (IOException ex) {
            throw new ProbeException("Failed to read output of " + command.get(0), ex);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    // descendants first; once the parent dies they are reparented and no longer listed
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private Process start(Path outputFile) throws ProbeException {
        try {
            return new ProcessBuilder(command)
                    .redirectOutput(outputFile.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException ex) {
            throw new ProbeException("Failed to launch " + command.get(0), ex);
        }
    }

    private Path createOutputFile() throws ProbeException {
        try {
            return Files.createTempFile("busylight-probe", ".out");
        } catch (IOException ex) {
            throw new ProbeException("Failed to create output buffer", ex);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.debug("Could not delete {}", file, ex);
        }
    }

    public List<String> command() {
        return command;
    }
}
