package com.busylight.aggregate;

import com.busylight.source.SourceId;

import java.util.Set;

@FunctionalInterface
public interface ActivityListener {

    /**
     * Called on the publishing thread whenever the set of active sources changes.
     *
     * @param activeSources unmodifiable, unordered
     */
    void onActiveSetChanged(Set<SourceId> activeSources);
}
