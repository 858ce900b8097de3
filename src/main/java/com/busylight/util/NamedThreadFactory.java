package com.busylight.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Daemon threads named {@code prefix-N}.
 */
public final class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private int counter = 0;

    public NamedThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public synchronized Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + counter++);
        thread.setDaemon(true);
        return thread;
    }
}
