package com.busylight.probe;

import org.apache.commons.lang3.math.NumberUtils;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a numeric measurement (a CPU percentage, a queue length) with a hysteresis band.
 *
 * <p>At or above {@code high} is active, at or below {@code low} is inactive; anything in
 * between is neutral so a value hovering near one threshold cannot flip the source.
 * The first capture group of {@code valuePattern} (or the whole match) is the value.
 */
public class ThresholdClassifier implements OutputClassifier {

    private final Pattern valuePattern;
    private final double low;
    private final double high;
    private final boolean percentAsProgress;

    public ThresholdClassifier(Pattern valuePattern, double low, double high, boolean percentAsProgress) {
        this.valuePattern = Objects.requireNonNull(valuePattern, "valuePattern");
        if (Double.isNaN(low) || Double.isNaN(high) || low > high) {
            throw new IllegalArgumentException("low must be <= high (low=" + low + ", high=" + high + ")");
        }
        this.low = low;
        this.high = high;
        this.percentAsProgress = percentAsProgress;
    }

    @Override
    public Reading classify(CommandOutput output) {
        Matcher matcher = valuePattern.matcher(output.stdout());
        if (!matcher.find()) {
            return Reading.inactive("no value");
        }
        String raw = matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
        double value = NumberUtils.toDouble(raw.trim(), Double.NaN);
        if (Double.isNaN(value)) {
            return Reading.inactive("unparseable value '" + raw + "'");
        }
        Reading reading;
        if (value >= high) {
            reading = Reading.active("value " + value);
        } else if (value <= low) {
            reading = Reading.inactive("value " + value);
        } else {
            reading = Reading.neutral("value " + value);
        }
        if (percentAsProgress) {
            reading = reading.withProgress(Math.max(0.0, Math.min(1.0, value / 100.0)));
        }
        return reading;
    }
}
