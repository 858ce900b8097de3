package com.busylight.config;

import com.busylight.util.PathUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Root log level and the rolling log file. A {@code null} file keeps logging on the console only.
 */
public record LoggingConfig(
        String level,
        String file,
        int maxSizeMB,
        int rotationCount
) {

    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");
    private static final String DEFAULT_LEVEL = "INFO";
    private static final int DEFAULT_MAX_SIZE_MB = 5;
    private static final int DEFAULT_ROTATION_COUNT = 5;

    @JsonCreator
    public static LoggingConfig create(
            @JsonProperty("level") String level,
            @JsonProperty("file") String file,
            @JsonProperty("maxSizeMB") Integer maxSizeMB,
            @JsonProperty("rotationCount") Integer rotationCount
    ) {
        return new LoggingConfig(
                normalizeLevel(level),
                StringUtils.trimToNull(file),
                maxSizeMB == null || maxSizeMB <= 0 ? DEFAULT_MAX_SIZE_MB : maxSizeMB,
                rotationCount == null || rotationCount <= 0 ? DEFAULT_ROTATION_COUNT : rotationCount
        );
    }

    public static LoggingConfig defaults(Path rootDir) {
        Objects.requireNonNull(rootDir, "rootDir");
        return new LoggingConfig(DEFAULT_LEVEL,
                rootDir.resolve("logs").resolve("busylight.log").toString(),
                DEFAULT_MAX_SIZE_MB,
                DEFAULT_ROTATION_COUNT);
    }

    /**
     * Absolute log file path with {@code ~} and environment references expanded.
     */
    public Path resolvedFile() {
        return file == null ? null : PathUtils.resolve(file);
    }

    private static String normalizeLevel(String candidate) {
        if (StringUtils.isBlank(candidate)) {
            return DEFAULT_LEVEL;
        }
        String upper = candidate.trim().toUpperCase(Locale.ROOT);
        return LEVELS.contains(upper) ? upper : DEFAULT_LEVEL;
    }
}
