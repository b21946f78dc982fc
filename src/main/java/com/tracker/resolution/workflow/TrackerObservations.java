package com.tracker.resolution.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Status transitions observed for one tracker, in observation order and
 * with duplicates. Mutable accumulator used while mining.
 */
public class TrackerObservations {

    private final String trackerName;
    private final Map<Integer, List<Integer>> targetsBySource = new LinkedHashMap<>();
    private int transitionCount;

    public TrackerObservations(String trackerName) {
        this.trackerName = trackerName;
    }

    public void record(StatusTransition transition) {
        targetsBySource.computeIfAbsent(transition.fromStatusId(), k -> new ArrayList<>())
                .add(transition.toStatusId());
        transitionCount++;
    }

    public void recordAll(List<StatusTransition> transitions) {
        transitions.forEach(this::record);
    }

    public String getTrackerName() {
        return trackerName;
    }

    public Map<Integer, List<Integer>> getTargetsBySource() {
        return Collections.unmodifiableMap(targetsBySource);
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public boolean isEmpty() {
        return transitionCount == 0;
    }
}
