package com.busylight.probe;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

public record Reading(
        Activity activity,
        OptionalDouble progress,
        Optional<String> detail,
        Instant timestamp
) {

    public Reading {
        Objects.requireNonNull(activity, "activity");
        Objects.requireNonNull(progress, "progress");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(timestamp, "timestamp");
        if (progress.isPresent()) {
            double value = progress.getAsDouble();
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException("progress must be within [0, 1]: " + value);
            }
        }
    }

    public static Reading active() {
        return of(Activity.ACTIVE, null);
    }

    public static Reading active(String detail) {
        return of(Activity.ACTIVE, detail);
    }

    public static Reading inactive() {
        return of(Activity.INACTIVE, null);
    }

    public static Reading inactive(String detail) {
        return of(Activity.INACTIVE, detail);
    }

    public static Reading neutral(String detail) {
        return of(Activity.NEUTRAL, detail);
    }

    public static Reading of(Activity activity, String detail) {
        return new Reading(activity, OptionalDouble.empty(), Optional.ofNullable(detail), Instant.now());
    }

    public Reading withProgress(double fraction) {
        return new Reading(activity, OptionalDouble.of(fraction), detail, timestamp);
    }

    public boolean isActive() {
        return activity == Activity.ACTIVE;
    }
}
