package com.tracker.resolution.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracker.resolution.core.model.Candidate;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow graph of one tracker: its status nodes and, per source status, the
 * ordered list of permitted target statuses. Keys are decimal status IDs.
 *
 * @param name        tracker display name
 * @param statuses    status nodes keyed by status ID
 * @param transitions permitted targets keyed by source status ID
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackerWorkflow(
        @JsonProperty("name") String name,
        @JsonProperty("statuses") Map<String, WorkflowStatus> statuses,
        @JsonProperty("transitions") Map<String, List<Integer>> transitions
) {
    public TrackerWorkflow {
        if (statuses != null) {
            statuses.keySet().forEach(TrackerWorkflow::requireNumericKey);
        }
        if (transitions != null) {
            transitions.keySet().forEach(TrackerWorkflow::requireNumericKey);
        }
        statuses = statuses != null ? Collections.unmodifiableMap(new LinkedHashMap<>(statuses)) : Map.of();
        if (transitions != null) {
            Map<String, List<Integer>> copy = new LinkedHashMap<>();
            transitions.forEach((from, targets) -> copy.put(from, targets != null ? List.copyOf(targets) : List.of()));
            transitions = Collections.unmodifiableMap(copy);
        } else {
            transitions = Map.of();
        }
    }

    /**
     * Returns the permitted targets of a source status, or empty when the
     * source status has no entry (no rule known).
     */
    public Optional<List<Integer>> targetsFrom(int fromStatusId) {
        return Optional.ofNullable(transitions.get(String.valueOf(fromStatusId)));
    }

    /**
     * Returns the display name of a status, or {@code Unknown(<id>)}.
     */
    public String statusName(int statusId) {
        WorkflowStatus status = statuses.get(String.valueOf(statusId));
        return status != null ? status.name() : "Unknown(" + statusId + ")";
    }

    public Candidate statusCandidate(int statusId) {
        return new Candidate(statusId, statusName(statusId));
    }

    /**
     * Returns all status nodes ordered by ID.
     */
    public List<Candidate> statusCandidates() {
        return statuses.entrySet().stream()
                .map(e -> new Candidate(Integer.parseInt(e.getKey()), e.getValue().name()))
                .sorted(Comparator.comparingInt(Candidate::id))
                .toList();
    }

    private static void requireNumericKey(String statusId) {
        try {
            Integer.parseInt(statusId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("status ID must be numeric: " + statusId, e);
        }
    }
}
