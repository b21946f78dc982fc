package com.tracker.resolution.exception;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.rules.RequiredField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionException Tests")
class ResolutionExceptionTest {

    @Test
    @DisplayName("Every subclass should report its kind")
    void kinds() {
        assertEquals(ErrorKind.NOT_FOUND, new EntityNotFoundException(EntityKind.PROJECT, "x").getKind());
        assertEquals(ErrorKind.AMBIGUOUS, new AmbiguousMatchException(EntityKind.PROJECT, "x", List.of()).getKind());
        assertEquals(ErrorKind.CONFIGURATION, new ConfigurationException("x").getKind());
        assertEquals(ErrorKind.VALIDATION, ValidationException.missingRequired(List.of()).getKind());
        assertEquals(ErrorKind.TRANSITION, new TransitionException(4, "Bug",
                new Candidate(1, "New"), new Candidate(2, "Done"), List.of()).getKind());
        assertEquals(ErrorKind.UPSTREAM, new UpstreamException("list-trackers", "x").getKind());
    }

    @Test
    @DisplayName("Callers should be able to branch on the kind")
    void branchOnKind() {
        ResolutionException e = new ConfigurationException("cannot search users without project context");

        String hint = switch (e.getKind()) {
            case NOT_FOUND, AMBIGUOUS -> "re-prompt";
            case CONFIGURATION -> "supply context";
            case VALIDATION, TRANSITION -> "fix payload";
            case UPSTREAM -> "retry later";
        };

        assertEquals("supply context", hint);
    }

    @Test
    @DisplayName("Custom field lookups should be labelled in messages")
    void customFieldLabel() {
        assertEquals("custom field not found: Severity",
                new EntityNotFoundException(EntityKind.CUSTOM_FIELD, "Severity").getMessage());
    }

    @Test
    @DisplayName("Ambiguous candidates should be an immutable copy")
    void candidatesCopied() {
        List<Candidate> candidates = new ArrayList<>(List.of(new Candidate(1, "Bug")));
        AmbiguousMatchException e = new AmbiguousMatchException(EntityKind.TRACKER, "b", candidates);
        candidates.add(new Candidate(2, "Blocker"));

        assertEquals(1, e.getCandidates().size());
        assertEquals(EntityKind.TRACKER, e.getEntityKind());
        assertEquals("b", e.getQuery());
    }

    @Test
    @DisplayName("Missing-field messages should describe free-text fields without values")
    void missingFreeTextField() {
        ValidationException e = ValidationException.missingRequired(List.of(
                new RequiredField(225, "Customer Reference", List.of()),
                new RequiredField(223, "Category", List.of("SW Tool", "HW"))));

        assertEquals("required custom field(s) missing: Customer Reference (ID: 225); "
                + "Category (ID: 223, values: SW Tool, HW)", e.getMessage());
        assertNull(e.getRejectedValue());
    }

    @Test
    @DisplayName("Upstream errors should keep the cause and the operation")
    void upstreamCause() {
        IOException cause = new IOException("connection reset");
        UpstreamException e = new UpstreamException("get-issue", "connection reset", cause);

        assertSame(cause, e.getCause());
        assertEquals("get-issue", e.getOperation());
        assertEquals("get-issue failed: connection reset", e.getMessage());
    }

    @Test
    @DisplayName("Transition messages should name both statuses and the allowed targets")
    void transitionMessage() {
        TransitionException e = new TransitionException(4, "Bug",
                new Candidate(33, "Open"), new Candidate(1, "New"),
                List.of(new Candidate(9, "Reopened"), new Candidate(20, "In Review")));

        assertEquals("cannot change Bug from 'Open' to 'New'. Allowed: Reopened, In Review", e.getMessage());
    }
}
