package com.busylight.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * What a source samples and how the result is classified. Which fields matter depends on
 * {@link #type()}; the others are ignored.
 */
public record ProbeConfig(
        ProbeType type,
        List<String> command,
        List<String> patterns,
        Integer lineCount,
        String valuePattern,
        Double low,
        Double high,
        Boolean percentAsProgress,
        List<String> keywords
) {

    private static final int DEFAULT_LINE_COUNT = 20;

    @JsonCreator
    public static ProbeConfig create(
            @JsonProperty("type") ProbeType type,
            @JsonProperty("command") List<String> command,
            @JsonProperty("patterns") List<String> patterns,
            @JsonProperty("lineCount") Integer lineCount,
            @JsonProperty("valuePattern") String valuePattern,
            @JsonProperty("low") Double low,
            @JsonProperty("high") Double high,
            @JsonProperty("percentAsProgress") Boolean percentAsProgress,
            @JsonProperty("keywords") List<String> keywords
    ) {
        if (type == null) {
            throw new IllegalArgumentException("probe.type is required");
        }
        List<String> resolvedCommand = cleanList(command);
        List<String> resolvedPatterns = cleanList(patterns);
        List<String> resolvedKeywords = cleanList(keywords);
        int resolvedLineCount = lineCount == null || lineCount <= 0 ? DEFAULT_LINE_COUNT : lineCount;
        boolean progress = Boolean.TRUE.equals(percentAsProgress);

        if (type.runsCommand() && resolvedCommand.isEmpty()) {
            throw new IllegalArgumentException(type + " probe needs a command");
        }
        switch (type) {
            case COMMAND_PATTERN -> {
                if (resolvedPatterns.isEmpty()) {
                    throw new IllegalArgumentException("COMMAND_PATTERN probe needs at least one pattern");
                }
                resolvedPatterns.forEach(Pattern::compile);
            }
            case COMMAND_THRESHOLD -> {
                if (StringUtils.isBlank(valuePattern)) {
                    throw new IllegalArgumentException("COMMAND_THRESHOLD probe needs a valuePattern");
                }
                Pattern.compile(valuePattern);
                if (high == null) {
                    throw new IllegalArgumentException("COMMAND_THRESHOLD probe needs a high threshold");
                }
                if (low != null && low > high) {
                    throw new IllegalArgumentException("low threshold " + low + " is above high threshold " + high);
                }
            }
            case WINDOW_TITLE -> {
                if (resolvedKeywords.isEmpty()) {
                    throw new IllegalArgumentException("WINDOW_TITLE probe needs at least one keyword");
                }
            }
        }
        Double resolvedLow = low == null ? high : low;
        return new ProbeConfig(type, resolvedCommand, resolvedPatterns, resolvedLineCount,
                valuePattern, resolvedLow, high, progress, resolvedKeywords);
    }

    public static ProbeConfig commandPattern(List<String> command, List<String> patterns, int lineCount) {
        return create(ProbeType.COMMAND_PATTERN, command, patterns, lineCount, null, null, null, null, null);
    }

    public static ProbeConfig commandThreshold(List<String> command, String valuePattern,
                                               double low, double high, boolean percentAsProgress) {
        return create(ProbeType.COMMAND_THRESHOLD, command, null, null, valuePattern, low, high,
                percentAsProgress, null);
    }

    public static ProbeConfig windowTitle(List<String> keywords) {
        return create(ProbeType.WINDOW_TITLE, null, null, null, null, null, null, null, keywords);
    }

    private static List<String> cleanList(List<String> entries) {
        if (entries == null) {
            return List.of();
        }
        return entries.stream()
                .filter(Objects::nonNull)
                .filter(StringUtils::isNotEmpty)
                .toList();
    }
}
