package com.tracker.resolution.exception;

import com.tracker.resolution.core.model.EntityKind;

/**
 * Thrown when a name lookup yields no candidate after both the exact and the
 * substring pass.
 */
public final class EntityNotFoundException extends ResolutionException {

    private final EntityKind entityKind;
    private final String query;

    public EntityNotFoundException(EntityKind entityKind, String query) {
        super(ErrorKind.NOT_FOUND, entityKind.getLabel() + " not found: " + query);
        this.entityKind = entityKind;
        this.query = query;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public String getQuery() {
        return query;
    }
}
