package com.busylight.debounce;

/**
 * Consecutive-reading thresholds for one source. Fast-show/slow-hide and symmetric
 * policies are both just values of this record.
 */
public record DebounceConfig(
        int requiredConsecutiveToActivate,
        int requiredConsecutiveToDeactivate
) {

    private static final int DEFAULT_TO_ACTIVATE = 1;
    private static final int DEFAULT_TO_DEACTIVATE = 3;

    public DebounceConfig {
        if (requiredConsecutiveToActivate < 1) {
            throw new IllegalArgumentException("requiredConsecutiveToActivate must be >= 1");
        }
        if (requiredConsecutiveToDeactivate < 1) {
            throw new IllegalArgumentException("requiredConsecutiveToDeactivate must be >= 1");
        }
    }

    public static DebounceConfig of(int toActivate, int toDeactivate) {
        return new DebounceConfig(toActivate, toDeactivate);
    }

    public static DebounceConfig symmetric(int required) {
        return new DebounceConfig(required, required);
    }

    public static DebounceConfig defaults() {
        return new DebounceConfig(DEFAULT_TO_ACTIVATE, DEFAULT_TO_DEACTIVATE);
    }
}
