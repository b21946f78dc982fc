package com.tracker.resolution.core.model;

/**
 * A single attribute change recorded in an issue journal.
 *
 * @param property kind of change ("attr", "cf", "attachment", ...)
 * @param name     changed attribute name (e.g. "status_id")
 * @param oldValue value before the change, may be null
 * @param newValue value after the change, may be null
 */
public record JournalDetail(String property, String name, String oldValue, String newValue) {

    public static final String ATTRIBUTE_PROPERTY = "attr";
    public static final String STATUS_ATTRIBUTE = "status_id";

    public static JournalDetail statusChange(int fromStatusId, int toStatusId) {
        return new JournalDetail(ATTRIBUTE_PROPERTY, STATUS_ATTRIBUTE,
                String.valueOf(fromStatusId), String.valueOf(toStatusId));
    }

    public boolean isStatusChange() {
        return ATTRIBUTE_PROPERTY.equals(property) && STATUS_ATTRIBUTE.equals(name);
    }
}
