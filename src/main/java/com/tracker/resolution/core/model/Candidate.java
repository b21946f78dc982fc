package com.tracker.resolution.core.model;

/**
 * An (id, name) pair. Returned as a lookup candidate when a name is ambiguous,
 * and used for the plain id/name references of the tracking backend.
 *
 * @param id   numeric identifier
 * @param name display name
 */
public record Candidate(int id, String name) {

    @Override
    public String toString() {
        return name + " (ID: " + id + ")";
    }
}
