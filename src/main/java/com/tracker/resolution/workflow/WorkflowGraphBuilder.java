package com.tracker.resolution.workflow;

import com.tracker.resolution.core.model.IssueStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns observed transitions into workflow graphs.
 *
 * <p>Each target list is deduplicated and sorted ascending. The node set holds
 * every status seen as a source or a target; names and closed flags come from
 * the global status list. Trackers without observations are omitted, which
 * leaves them unconstrained at validation time.</p>
 */
public final class WorkflowGraphBuilder {

    private WorkflowGraphBuilder() {
        // Utility class
    }

    public static WorkflowRules build(List<IssueStatus> statuses, Map<Integer, TrackerObservations> observations) {
        Map<Integer, IssueStatus> statusLookup = statuses.stream()
                .collect(Collectors.toMap(IssueStatus::id, Function.identity(), (a, b) -> a));

        Map<String, TrackerWorkflow> trackers = new LinkedHashMap<>();
        observations.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    TrackerObservations observed = entry.getValue();
                    if (observed.isEmpty()) {
                        return;
                    }
                    trackers.put(String.valueOf(entry.getKey()), buildTracker(observed, statusLookup));
                });
        return new WorkflowRules(trackers);
    }

    private static TrackerWorkflow buildTracker(TrackerObservations observed, Map<Integer, IssueStatus> statusLookup) {
        TreeSet<Integer> referenced = new TreeSet<>();
        Map<String, List<Integer>> transitions = new LinkedHashMap<>();

        new TreeSet<>(observed.getTargetsBySource().keySet()).forEach(fromId -> {
            List<Integer> targets = List.copyOf(new TreeSet<>(observed.getTargetsBySource().get(fromId)));
            transitions.put(String.valueOf(fromId), targets);
            referenced.add(fromId);
            referenced.addAll(targets);
        });

        Map<String, WorkflowStatus> nodes = new LinkedHashMap<>();
        for (Integer statusId : referenced) {
            IssueStatus known = statusLookup.get(statusId);
            nodes.put(String.valueOf(statusId), known != null
                    ? new WorkflowStatus(known.name(), known.closed())
                    : new WorkflowStatus("Unknown(" + statusId + ")", false));
        }
        return new TrackerWorkflow(observed.getTrackerName(), nodes, transitions);
    }
}
