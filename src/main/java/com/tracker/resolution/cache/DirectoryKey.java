package com.tracker.resolution.cache;

import com.tracker.resolution.core.model.EntityKind;

import java.util.Objects;

/**
 * Cache key of one directory list.
 *
 * @param kind      entity kind of the list
 * @param projectId project scope, 0 when global
 * @param trackerId tracker scope, 0 when not tracker-specific
 */
public record DirectoryKey(EntityKind kind, int projectId, int trackerId) {

    public DirectoryKey {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static DirectoryKey global(EntityKind kind) {
        return new DirectoryKey(kind, 0, 0);
    }

    public static DirectoryKey forProject(EntityKind kind, int projectId) {
        return new DirectoryKey(kind, projectId, 0);
    }

    public static DirectoryKey forProjectTracker(EntityKind kind, int projectId, int trackerId) {
        return new DirectoryKey(kind, projectId, trackerId);
    }
}
