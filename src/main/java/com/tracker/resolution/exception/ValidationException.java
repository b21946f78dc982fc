package com.tracker.resolution.exception;

import com.tracker.resolution.rules.RequiredField;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a custom field value is outside its allowed set, or when
 * fields required by the tracker are missing from a payload.
 *
 * <p>Invalid-value errors carry the field, the rejected value and the allowed
 * values. Missing-field errors carry the list of missing fields.</p>
 */
public final class ValidationException extends ResolutionException {

    private final Integer fieldId;
    private final String fieldName;
    private final String rejectedValue;
    private final List<String> allowedValues;
    private final List<RequiredField> missingFields;

    private ValidationException(String message, Integer fieldId, String fieldName, String rejectedValue,
                                List<String> allowedValues, List<RequiredField> missingFields) {
        super(ErrorKind.VALIDATION, message);
        this.fieldId = fieldId;
        this.fieldName = fieldName;
        this.rejectedValue = rejectedValue;
        this.allowedValues = List.copyOf(allowedValues);
        this.missingFields = List.copyOf(missingFields);
    }

    public static ValidationException invalidValue(int fieldId, String fieldName, String value,
                                                   List<String> allowedValues) {
        String message = String.format("invalid value \"%s\" for %s (ID: %d). Valid values: %s",
                value, fieldName, fieldId, String.join(", ", allowedValues));
        return new ValidationException(message, fieldId, fieldName, value, allowedValues, List.of());
    }

    public static ValidationException missingRequired(List<RequiredField> missing) {
        String message = "required custom field(s) missing: " + missing.stream()
                .map(RequiredField::describe)
                .collect(Collectors.joining("; "));
        return new ValidationException(message, null, null, null, List.of(), missing);
    }

    public boolean isMissingRequired() {
        return !missingFields.isEmpty();
    }

    /**
     * Returns the offending field ID, or null for missing-field errors.
     */
    public Integer getFieldId() {
        return fieldId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }

    public List<String> getAllowedValues() {
        return allowedValues;
    }

    public List<RequiredField> getMissingFields() {
        return missingFields;
    }
}
