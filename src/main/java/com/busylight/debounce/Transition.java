package com.busylight.debounce;

public enum Transition {
    ACTIVATED,
    DEACTIVATED;

    public boolean active() {
        return this == ACTIVATED;
    }
}
