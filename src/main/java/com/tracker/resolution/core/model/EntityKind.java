package com.tracker.resolution.core.model;

/**
 * Kinds of directory entities that can be resolved from a name or ID.
 */
public enum EntityKind {
    PROJECT("project"),
    TRACKER("tracker"),
    STATUS("status"),
    PRIORITY("priority"),
    ACTIVITY("activity"),
    USER("user"),
    CUSTOM_FIELD("custom field");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
