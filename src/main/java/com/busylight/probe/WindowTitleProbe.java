package com.busylight.probe;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Active while some visible window title contains one of the keywords, ignoring case.
 *
 * <p>Progress dialogs usually show a percentage in their title; the first {@code NN%} in the
 * matching title is reported as progress.
 */
public abstract class WindowTitleProbe implements Probe {

    private static final Pattern PERCENT = Pattern.compile("(\\d{1,3})\\s*%");

    private final List<String> keywords;

    protected WindowTitleProbe(List<String> keywords) {
        Objects.requireNonNull(keywords, "keywords");
        List<String> cleaned = keywords.stream()
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .toList();
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("at least one keyword is required");
        }
        this.keywords = cleaned;
    }

    /**
     * Titles of the currently visible top-level windows.
     */
    protected abstract List<String> visibleWindowTitles() throws ProbeException;

    @Override
    public Reading sample(Duration timeout) throws ProbeException {
        for (String title : visibleWindowTitles()) {
            if (title == null || !containsKeyword(title)) {
                continue;
            }
            Reading reading = Reading.active(StringUtils.abbreviate(title, 100));
            OptionalDouble progress = percentage(title);
            return progress.isPresent() ? reading.withProgress(progress.getAsDouble()) : reading;
        }
        return Reading.inactive();
    }

    private boolean containsKeyword(String title) {
        for (String keyword : keywords) {
            if (StringUtils.containsIgnoreCase(title, keyword)) {
                return true;
            }
        }
        return false;
    }

    static OptionalDouble percentage(String title) {
        Matcher matcher = PERCENT.matcher(title);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        int value = Integer.parseInt(matcher.group(1));
        if (value > 100) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value / 100.0);
    }

    public List<String> keywords() {
        return keywords;
    }
}
