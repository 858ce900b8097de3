package com.busylight.aggregate;

import com.busylight.debounce.Transition;
import com.busylight.probe.Reading;
import com.busylight.runner.SourceEventListener;
import com.busylight.source.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Merges the transitions of every source into one published set of active sources.
 *
 * <p>Only transitions trigger a recomputation; listeners are told only when the set
 * actually changed. Mutating callbacks must arrive on the publishing thread.
 */
public class ActivityAggregator implements SourceEventListener {

    private static final Logger log = LoggerFactory.getLogger(ActivityAggregator.class);

    private final Map<SourceId, Boolean> sourceStates = new HashMap<>();
    private final Map<SourceId, Reading> lastReadings = new ConcurrentHashMap<>();
    private final List<ActivityListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong recomputations = new AtomicLong();

    private volatile Set<SourceId> activeSet = Set.of();

    public void addListener(ActivityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ActivityListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onTransition(SourceId source, Transition transition) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transition, "transition");
        sourceStates.put(source, transition.active());
        recompute();
    }

    @Override
    public void onReading(SourceId source, Reading reading) {
        lastReadings.put(source, reading);
    }

    @Override
    public void onReset(SourceId source) {
        // a reset source is inactive; its deactivation has already been applied
        sourceStates.remove(source);
        lastReadings.remove(source);
    }

    private void recompute() {
        recomputations.incrementAndGet();
        Set<SourceId> recomputed = sourceStates.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
        if (recomputed.equals(activeSet)) {
            return;
        }
        activeSet = recomputed;
        log.debug("Active sources: {}", recomputed);
        for (ActivityListener listener : listeners) {
            try {
                listener.onActiveSetChanged(recomputed);
            } catch (RuntimeException ex) {
                log.error("Activity listener failed", ex);
            }
        }
    }

    public Set<SourceId> activeSet() {
        return activeSet;
    }

    /**
     * Last reading applied for {@code source} since it was registered or last reset.
     */
    public Optional<Reading> lastReading(SourceId source) {
        return Optional.ofNullable(lastReadings.get(source));
    }

    int trackedSourceCount() {
        return sourceStates.size();
    }

    long recomputationCount() {
        return recomputations.get();
    }
}
