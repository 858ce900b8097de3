package com.busylight.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record AppConfig(
        Duration tickInterval,
        LoggingConfig logging,
        List<SourceConfig> sources
) {

    private static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);

    @JsonCreator
    public static AppConfig create(
            @JsonProperty("tickInterval") Duration tickInterval,
            @JsonProperty("logging") LoggingConfig logging,
            @JsonProperty("sources") List<SourceConfig> sources
    ) {
        Duration tick = tickInterval == null ? DEFAULT_TICK_INTERVAL : tickInterval;
        if (tick.toMillis() < 1) {
            throw new IllegalArgumentException("tickInterval must be at least 1 ms: " + tick);
        }
        LoggingConfig resolvedLogging = logging == null ? LoggingConfig.defaults(defaultRoot()) : logging;
        List<SourceConfig> resolvedSources = sources == null
                ? List.of()
                : sources.stream().filter(Objects::nonNull).toList();
        Set<String> ids = new HashSet<>();
        for (SourceConfig source : resolvedSources) {
            if (!ids.add(source.id())) {
                throw new IllegalArgumentException("Duplicate source id '" + source.id() + "'");
            }
        }
        return new AppConfig(tick, resolvedLogging, resolvedSources);
    }

    public List<SourceConfig> enabledSources() {
        return sources.stream().filter(SourceConfig::enabled).toList();
    }

    static Path defaultRoot() {
        String appData = System.getenv("APPDATA");
        if (appData == null || appData.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".busylight");
        }
        return Path.of(appData, "BusyLight");
    }

    public static AppConfig defaults() {
        return new AppConfig(DEFAULT_TICK_INTERVAL, LoggingConfig.defaults(defaultRoot()), List.of());
    }
}
