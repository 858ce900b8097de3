package com.busylight.probe;

import java.time.Duration;

/**
 * Samples the current activity of one source.
 *
 * <p>Never invoked concurrently with itself. Implementations either honour {@code timeout}
 * or give up promptly when their thread is interrupted. A missing process, window or
 * permission is an ordinary inactive reading, not an error.
 */
public interface Probe extends AutoCloseable {

    Reading sample(Duration timeout) throws ProbeException, InterruptedException;

    @Override
    default void close() {
        // default noop
    }
}
