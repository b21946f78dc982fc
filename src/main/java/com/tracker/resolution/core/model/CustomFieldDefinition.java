package com.tracker.resolution.core.model;

/**
 * Custom field definition derived from a sample issue. Available without
 * privileges, but carries no value set or tracker scoping.
 *
 * @param id          field ID
 * @param name        display name
 * @param fieldFormat field format, or "unknown" when derived from issue data
 */
public record CustomFieldDefinition(int id, String name, String fieldFormat) {
}
