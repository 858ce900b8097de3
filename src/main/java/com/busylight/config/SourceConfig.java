package com.busylight.config;

import com.busylight.debounce.DebounceConfig;
import com.busylight.source.SourceId;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Objects;

/**
 * One monitored source as declared in the configuration file.
 *
 * @param timeout         deadline of one sample; {@code null} means the probe runs without one
 * @param requiresProcess executable that must be running for the probe to be invoked
 */
public record SourceConfig(
        String id,
        boolean enabled,
        int activateAfter,
        int deactivateAfter,
        Duration timeout,
        int idleThrottle,
        boolean verbose,
        String requiresProcess,
        ProbeConfig probe
) {

    private static final int DEFAULT_ACTIVATE_AFTER = 1;
    private static final int DEFAULT_DEACTIVATE_AFTER = 3;
    private static final int DEFAULT_IDLE_THROTTLE = 1;
    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

    @JsonCreator
    public static SourceConfig create(
            @JsonProperty("id") String id,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("activateAfter") Integer activateAfter,
            @JsonProperty("deactivateAfter") Integer deactivateAfter,
            @JsonProperty("timeout") Duration timeout,
            @JsonProperty("idleThrottle") Integer idleThrottle,
            @JsonProperty("verbose") Boolean verbose,
            @JsonProperty("requiresProcess") String requiresProcess,
            @JsonProperty("probe") ProbeConfig probe
    ) {
        String resolvedId = SourceId.of(Objects.toString(id, "")).value();
        if (probe == null) {
            throw new IllegalArgumentException("Source " + resolvedId + " has no probe");
        }
        int toActivate = activateAfter == null ? DEFAULT_ACTIVATE_AFTER : activateAfter;
        int toDeactivate = deactivateAfter == null ? DEFAULT_DEACTIVATE_AFTER : deactivateAfter;
        DebounceConfig.of(toActivate, toDeactivate);
        int throttle = idleThrottle == null ? DEFAULT_IDLE_THROTTLE : idleThrottle;
        if (throttle < 1) {
            throw new IllegalArgumentException("Source " + resolvedId + ": idleThrottle must be >= 1");
        }
        Duration resolvedTimeout = timeout;
        if (resolvedTimeout == null && probe.type().runsCommand()) {
            resolvedTimeout = DEFAULT_COMMAND_TIMEOUT;
        }
        if (resolvedTimeout != null && (resolvedTimeout.isNegative() || resolvedTimeout.isZero())) {
            throw new IllegalArgumentException("Source " + resolvedId + ": timeout must be positive");
        }
        return new SourceConfig(
                resolvedId,
                enabled == null || enabled,
                toActivate,
                toDeactivate,
                resolvedTimeout,
                throttle,
                Boolean.TRUE.equals(verbose),
                StringUtils.trimToNull(requiresProcess),
                probe
        );
    }

    public SourceId sourceId() {
        return SourceId.of(id);
    }

    public DebounceConfig debounce() {
        return DebounceConfig.of(activateAfter, deactivateAfter);
    }
}
