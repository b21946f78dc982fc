package com.tracker.resolution.core.model;

/**
 * A global issue status.
 *
 * @param id     numeric identifier
 * @param name   display name
 * @param closed whether issues in this status count as closed
 */
public record IssueStatus(int id, String name, boolean closed) {
}
