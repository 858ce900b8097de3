package com.busylight.probe;

/**
 * Inexpensive condition evaluated before a probe; when it fails the probe is skipped
 * and the sample counts as inactive.
 */
@FunctionalInterface
public interface Precheck {

    Precheck ALWAYS = () -> true;

    boolean passes();
}
