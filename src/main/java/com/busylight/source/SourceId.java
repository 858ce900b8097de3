package com.busylight.source;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable identifier of one monitored source.
 */
public record SourceId(String value) implements Comparable<SourceId> {

    private static final Pattern VALID = Pattern.compile("[a-z0-9._-]+");

    public SourceId {
        Objects.requireNonNull(value, "value");
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid source id: '" + value + "'");
        }
    }

    public static SourceId of(String value) {
        return new SourceId(value);
    }

    @Override
    public int compareTo(SourceId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
