package com.busylight.debounce;

public record DebounceSnapshot(
        int consecutiveActiveReadings,
        int consecutiveInactiveReadings,
        boolean active
) {

    public static final DebounceSnapshot INITIAL = new DebounceSnapshot(0, 0, false);
}
