package com.busylight.probe;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Active when any of the last {@code lineCount} non-blank lines of any session matches one
 * of the patterns.
 *
 * <p>Output that concatenates several terminal sessions marks each with
 * {@value #SESSION_MARKER} or {@value #TAB_MARKER}; only the tail of each session is
 * searched so that stale scrollback cannot keep a source active.
 */
public class PatternClassifier implements OutputClassifier {

    public static final String SESSION_MARKER = "---SESSION---";
    public static final String TAB_MARKER = "---TAB---";

    private final List<Pattern> patterns;
    private final int lineCount;

    public PatternClassifier(List<Pattern> patterns, int lineCount) {
        Objects.requireNonNull(patterns, "patterns");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("at least one pattern is required");
        }
        if (lineCount < 1) {
            throw new IllegalArgumentException("lineCount must be >= 1");
        }
        this.patterns = List.copyOf(patterns);
        this.lineCount = lineCount;
    }

    public static PatternClassifier ofRegex(List<String> regexes, int lineCount) {
        return new PatternClassifier(regexes.stream().map(Pattern::compile).toList(), lineCount);
    }

    @Override
    public Reading classify(CommandOutput output) {
        for (List<String> tail : sessionTails(output.stdout())) {
            for (String line : tail) {
                for (Pattern pattern : patterns) {
                    if (pattern.matcher(line).find()) {
                        return Reading.active(StringUtils.abbreviate(line, 100));
                    }
                }
            }
        }
        return Reading.inactive();
    }

    List<List<String>> sessionTails(String stdout) {
        List<List<String>> tails = new ArrayList<>();
        for (String session : splitSessions(stdout)) {
            List<String> lines = Arrays.stream(session.split("\\R"))
                    .map(StringUtils::strip)
                    .filter(StringUtils::isNotEmpty)
                    .toList();
            if (lines.isEmpty()) {
                continue;
            }
            tails.add(lines.subList(Math.max(0, lines.size() - lineCount), lines.size()));
        }
        return tails;
    }

    private static String[] splitSessions(String stdout) {
        if (StringUtils.isBlank(stdout)) {
            return new String[0];
        }
        if (stdout.contains(SESSION_MARKER)) {
            return StringUtils.splitByWholeSeparator(stdout, SESSION_MARKER);
        }
        if (stdout.contains(TAB_MARKER)) {
            return StringUtils.splitByWholeSeparator(stdout, TAB_MARKER);
        }
        return new String[]{stdout};
    }
}
