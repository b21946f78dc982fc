package com.tracker.resolution.exception;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.EntityKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a name matches more than one directory entry. Carries every
 * candidate so the caller can re-prompt; no candidate is preferred.
 */
public final class AmbiguousMatchException extends ResolutionException {

    private final EntityKind entityKind;
    private final String query;
    private final List<Candidate> candidates;

    public AmbiguousMatchException(EntityKind entityKind, String query, List<Candidate> candidates) {
        super(ErrorKind.AMBIGUOUS, "multiple " + entityKind.getLabel() + " match '" + query + "': "
                + candidates.stream().map(Candidate::toString).collect(Collectors.joining(", ")));
        this.entityKind = entityKind;
        this.query = query;
        this.candidates = List.copyOf(candidates);
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public String getQuery() {
        return query;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }
}
