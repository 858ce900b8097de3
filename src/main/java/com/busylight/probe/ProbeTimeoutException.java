package com.busylight.probe;

import java.time.Duration;

/**
 * Thrown by a probe that gave up on its own when the timeout passed.
 */
public class ProbeTimeoutException extends ProbeException {

    private final Duration timeout;

    public ProbeTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
