package com.tracker.resolution.core.model;

/**
 * A project entry of the directory.
 *
 * @param id         numeric identifier
 * @param name       display name
 * @param identifier short URL identifier (e.g. "web-portal")
 */
public record Project(int id, String name, String identifier) {
}
