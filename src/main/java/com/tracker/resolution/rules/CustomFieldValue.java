package com.tracker.resolution.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A custom field payload value: a single value, or a list of values for
 * multi-select fields. Both variants are validated element by element through
 * the same scalar rule.
 */
public sealed interface CustomFieldValue permits CustomFieldValue.Single, CustomFieldValue.Multiple {

    /**
     * Returns the contained values in order.
     */
    List<String> asList();

    /**
     * Returns a value of the same variant with every element mapped.
     */
    CustomFieldValue map(UnaryOperator<String> mapper);

    /**
     * Converts the raw payload value of a tool call. Collections become
     * {@link Multiple}; anything else becomes {@link Single}.
     */
    static CustomFieldValue fromRaw(Object raw) {
        Objects.requireNonNull(raw, "custom field value is required");
        if (raw instanceof Collection<?> items) {
            List<String> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(String.valueOf(item));
            }
            return new Multiple(values);
        }
        return new Single(String.valueOf(raw));
    }

    static CustomFieldValue single(String value) {
        return new Single(value);
    }

    static CustomFieldValue multiple(List<String> values) {
        return new Multiple(values);
    }

    record Single(String value) implements CustomFieldValue {

        public Single {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public List<String> asList() {
            return List.of(value);
        }

        @Override
        public CustomFieldValue map(UnaryOperator<String> mapper) {
            return new Single(mapper.apply(value));
        }
    }

    record Multiple(List<String> values) implements CustomFieldValue {

        public Multiple {
            values = List.copyOf(values);
        }

        @Override
        public List<String> asList() {
            return values;
        }

        @Override
        public CustomFieldValue map(UnaryOperator<String> mapper) {
            return new Multiple(values.stream().map(mapper).toList());
        }
    }
}
