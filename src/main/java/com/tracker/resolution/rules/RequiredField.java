package com.tracker.resolution.rules;

import java.util.List;

/**
 * A mandatory custom field absent from a payload.
 *
 * @param fieldId       field ID
 * @param name          display name
 * @param allowedValues value hint, empty for free-text fields
 */
public record RequiredField(int fieldId, String name, List<String> allowedValues) {

    public RequiredField {
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
    }

    /**
     * Renders the field as e.g. {@code Category (ID: 223, values: SW Tool, HW)}.
     */
    public String describe() {
        if (allowedValues.isEmpty()) {
            return String.format("%s (ID: %d)", name, fieldId);
        }
        return String.format("%s (ID: %d, values: %s)", name, fieldId, String.join(", ", allowedValues));
    }
}
