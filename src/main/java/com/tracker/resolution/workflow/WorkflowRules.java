package com.tracker.resolution.workflow;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.exception.TransitionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-tracker status transition rules, either hand-authored or mined from
 * issue history.
 *
 * <p>Only known rules are enforced. A tracker without a graph, or a source
 * status without an entry in its tracker's graph, allows any transition.
 * A source status whose entry is an empty list allows none.</p>
 */
public final class WorkflowRules {

    private static final WorkflowRules EMPTY = new WorkflowRules(Map.of());

    private final Map<String, TrackerWorkflow> trackers;

    public WorkflowRules(Map<String, TrackerWorkflow> trackers) {
        Map<String, TrackerWorkflow> copy = new LinkedHashMap<>();
        trackers.forEach((id, workflow) -> {
            try {
                Integer.parseInt(id);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("tracker ID must be numeric: " + id, e);
            }
            copy.put(id, workflow);
        });
        this.trackers = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a rule set without any tracker; every transition passes.
     */
    public static WorkflowRules empty() {
        return EMPTY;
    }

    /**
     * Merges two rule sets. A tracker present in {@code generated} replaces
     * the curated graph entirely; trackers present only in {@code curated}
     * are kept.
     */
    public static WorkflowRules merge(WorkflowRules curated, WorkflowRules generated) {
        if (generated == null || generated.isEmpty()) {
            return curated != null ? curated : EMPTY;
        }
        if (curated == null || curated.isEmpty()) {
            return generated;
        }
        Map<String, TrackerWorkflow> merged = new LinkedHashMap<>(curated.trackers);
        merged.putAll(generated.trackers);
        return new WorkflowRules(merged);
    }

    /**
     * Checks whether a status change is permitted.
     *
     * @throws TransitionException if the tracker and source status are known
     *                             and the target is not among the permitted targets
     */
    public void validateTransition(int trackerId, int fromStatusId, int toStatusId) {
        TrackerWorkflow tracker = trackers.get(String.valueOf(trackerId));
        if (tracker == null) {
            return;
        }
        Optional<List<Integer>> targets = tracker.targetsFrom(fromStatusId);
        if (targets.isEmpty() || targets.get().contains(toStatusId)) {
            return;
        }
        List<Candidate> allowed = targets.get().stream().map(tracker::statusCandidate).toList();
        throw new TransitionException(trackerId, tracker.name(),
                tracker.statusCandidate(fromStatusId), tracker.statusCandidate(toStatusId), allowed);
    }

    /**
     * Returns the permitted targets of a status in permitted order, or an
     * empty list when the tracker or status has no rule.
     */
    public List<Candidate> allowedTargets(int trackerId, int fromStatusId) {
        TrackerWorkflow tracker = trackers.get(String.valueOf(trackerId));
        if (tracker == null) {
            return List.of();
        }
        return tracker.targetsFrom(fromStatusId)
                .map(ids -> ids.stream().map(tracker::statusCandidate).toList())
                .orElse(List.of());
    }

    /**
     * Returns true if a transition rule exists for the status, even one that
     * permits nothing.
     */
    public boolean hasRule(int trackerId, int fromStatusId) {
        return getTracker(trackerId).flatMap(t -> t.targetsFrom(fromStatusId)).isPresent();
    }

    /**
     * Returns the status nodes of a tracker ordered by ID, or an empty list.
     */
    public List<Candidate> trackerStatuses(int trackerId) {
        return getTracker(trackerId).map(TrackerWorkflow::statusCandidates).orElse(List.of());
    }

    public Optional<TrackerWorkflow> getTracker(int trackerId) {
        return Optional.ofNullable(trackers.get(String.valueOf(trackerId)));
    }

    public Map<String, TrackerWorkflow> getTrackers() {
        return trackers;
    }

    public int size() {
        return trackers.size();
    }

    public boolean isEmpty() {
        return trackers.isEmpty();
    }

    @Override
    public String toString() {
        return "WorkflowRules{trackers=" + trackers.size() + '}';
    }
}
