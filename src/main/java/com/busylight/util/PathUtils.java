package com.busylight.util;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ~}, {@code %VAR%} and {@code ${VAR}} in paths taken from the configuration.
 */
public final class PathUtils {

    private static final Pattern ENV_REFERENCE = Pattern.compile("%([A-Za-z0-9_]+)%|\\$\\{([^}]+)}");

    private PathUtils() {
    }

    public static Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        return Path.of(expand(path)).toAbsolutePath().normalize();
    }

    public static Path resolveOrDefault(String candidate, Path defaultPath) {
        Objects.requireNonNull(defaultPath, "defaultPath");
        if (StringUtils.isBlank(candidate)) {
            return defaultPath.toAbsolutePath().normalize();
        }
        return resolve(candidate);
    }

    public static String expand(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String expanded = replaceEnv(trimmed, System.getenv());
        if (expanded.equals("~") || expanded.startsWith("~/") || expanded.startsWith("~\\")) {
            String home = System.getProperty("user.home");
            if (StringUtils.isNotBlank(home)) {
                expanded = home + expanded.substring(1);
            }
        }
        return expanded;
    }

    /**
     * Replaces environment references; unknown variables are left as written.
     */
    static String replaceEnv(String input, Map<String, String> env) {
        Matcher matcher = ENV_REFERENCE.matcher(input);
        return matcher.replaceAll(match -> {
            String key = match.group(1) != null ? match.group(1) : match.group(2);
            String value = lookup(env, key);
            return Matcher.quoteReplacement(value == null ? match.group() : value);
        });
    }

    private static String lookup(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            value = env.get(key.toUpperCase(Locale.ROOT));
        }
        if (value == null) {
            value = env.get(key.toLowerCase(Locale.ROOT));
        }
        return value;
    }
}
