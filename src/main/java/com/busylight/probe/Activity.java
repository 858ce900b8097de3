package com.busylight.probe;

public enum Activity {
    ACTIVE,
    INACTIVE,
    /**
     * Inside a probe's hysteresis band; leaves debounce state untouched.
     */
    NEUTRAL
}
