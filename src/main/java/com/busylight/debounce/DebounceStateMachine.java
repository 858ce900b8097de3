package com.busylight.debounce;

import com.busylight.probe.Activity;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw readings into stable activity transitions.
 *
 * <p>An active reading clears the inactive streak and vice versa, so at most one counter is
 * non-zero. A neutral reading changes nothing. Not thread-safe: callers confine it to the
 * publishing thread. {@link #snapshot()} may be read from any thread.
 */
public class DebounceStateMachine {

    private final DebounceConfig config;

    private int consecutiveActive;
    private int consecutiveInactive;
    private boolean active;

    private volatile DebounceSnapshot snapshot = DebounceSnapshot.INITIAL;

    public DebounceStateMachine(DebounceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public Optional<Transition> update(Activity reading) {
        Objects.requireNonNull(reading, "reading");
        Optional<Transition> transition = switch (reading) {
            case ACTIVE -> onActive();
            case INACTIVE -> onInactive();
            case NEUTRAL -> Optional.empty();
        };
        publishSnapshot();
        return transition;
    }

    /**
     * Forces {@code {0, 0, false}}. Reports {@link Transition#DEACTIVATED} when the source
     * was visible so downstream state can drop it.
     */
    public Optional<Transition> reset() {
        boolean wasActive = active;
        consecutiveActive = 0;
        consecutiveInactive = 0;
        active = false;
        publishSnapshot();
        return wasActive ? Optional.of(Transition.DEACTIVATED) : Optional.empty();
    }

    public DebounceSnapshot snapshot() {
        return snapshot;
    }

    public boolean isActive() {
        return snapshot.active();
    }

    public DebounceConfig config() {
        return config;
    }

    private Optional<Transition> onActive() {
        consecutiveActive = saturatingIncrement(consecutiveActive);
        consecutiveInactive = 0;
        if (consecutiveActive >= config.requiredConsecutiveToActivate() && !active) {
            active = true;
            return Optional.of(Transition.ACTIVATED);
        }
        return Optional.empty();
    }

    private Optional<Transition> onInactive() {
        consecutiveInactive = saturatingIncrement(consecutiveInactive);
        consecutiveActive = 0;
        if (consecutiveInactive >= config.requiredConsecutiveToDeactivate() && active) {
            active = false;
            return Optional.of(Transition.DEACTIVATED);
        }
        return Optional.empty();
    }

    private void publishSnapshot() {
        snapshot = new DebounceSnapshot(consecutiveActive, consecutiveInactive, active);
    }

    private static int saturatingIncrement(int value) {
        return value == Integer.MAX_VALUE ? value : value + 1;
    }
}
