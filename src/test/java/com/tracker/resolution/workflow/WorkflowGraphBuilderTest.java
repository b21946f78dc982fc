package com.tracker.resolution.workflow;

import com.tracker.resolution.core.model.IssueStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkflowGraphBuilder Tests")
class WorkflowGraphBuilderTest {

    private static final List<IssueStatus> STATUSES = List.of(
            new IssueStatus(1, "New", false),
            new IssueStatus(2, "In Progress", false),
            new IssueStatus(3, "Closed", true));

    @Test
    @DisplayName("Targets should be deduplicated and sorted regardless of observation order")
    void dedupesAndSorts() {
        TrackerObservations observed = new TrackerObservations("Bug");
        observed.recordAll(List.of(
                new StatusTransition(1, 3),
                new StatusTransition(1, 2),
                new StatusTransition(1, 2)));

        WorkflowRules rules = WorkflowGraphBuilder.build(STATUSES, Map.of(4, observed));
        TrackerWorkflow bug = rules.getTracker(4).orElseThrow();

        assertEquals(Map.of("1", List.of(2, 3)), bug.transitions());
        assertEquals("Bug", bug.name());
        assertEquals(3, observed.getTransitionCount());
    }

    @Test
    @DisplayName("Nodes should cover every source and target with global names")
    void nodesFromGlobalStatuses() {
        TrackerObservations observed = new TrackerObservations("Bug");
        observed.record(new StatusTransition(2, 3));

        TrackerWorkflow bug = WorkflowGraphBuilder.build(STATUSES, Map.of(4, observed)).getTracker(4).orElseThrow();

        assertEquals(List.of("2", "3"), List.copyOf(bug.statuses().keySet()));
        assertEquals(new WorkflowStatus("Closed", true), bug.statuses().get("3"));
        assertFalse(bug.statuses().containsKey("1"));
    }

    @Test
    @DisplayName("Statuses missing from the global list should still become nodes")
    void unknownStatusNode() {
        TrackerObservations observed = new TrackerObservations("Bug");
        observed.record(new StatusTransition(1, 77));

        TrackerWorkflow bug = WorkflowGraphBuilder.build(STATUSES, Map.of(4, observed)).getTracker(4).orElseThrow();

        assertEquals(new WorkflowStatus("Unknown(77)", false), bug.statuses().get("77"));
    }

    @Test
    @DisplayName("Trackers without observed transitions should be omitted")
    void omitsEmptyTrackers() {
        TrackerObservations empty = new TrackerObservations("Feature");
        TrackerObservations observed = new TrackerObservations("Bug");
        observed.record(new StatusTransition(1, 2));
        Map<Integer, TrackerObservations> observations = new LinkedHashMap<>();
        observations.put(5, empty);
        observations.put(4, observed);

        WorkflowRules rules = WorkflowGraphBuilder.build(STATUSES, observations);

        assertEquals(1, rules.size());
        assertTrue(rules.getTracker(5).isEmpty());
        assertDoesNotThrow(() -> rules.validateTransition(5, 3, 1));
    }

    @Test
    @DisplayName("Source statuses should be ordered ascending")
    void sourcesOrdered() {
        TrackerObservations observed = new TrackerObservations("Bug");
        observed.record(new StatusTransition(3, 1));
        observed.record(new StatusTransition(1, 2));
        observed.record(new StatusTransition(2, 3));

        TrackerWorkflow bug = WorkflowGraphBuilder.build(STATUSES, Map.of(4, observed)).getTracker(4).orElseThrow();

        assertEquals(List.of("1", "2", "3"), List.copyOf(bug.transitions().keySet()));
    }
}
