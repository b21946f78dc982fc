package com.tracker.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomFieldValue Tests")
class CustomFieldValueTest {

    @Test
    @DisplayName("A scalar raw value should become a single value")
    void scalarBecomesSingle() {
        CustomFieldValue value = CustomFieldValue.fromRaw("HW");

        assertInstanceOf(CustomFieldValue.Single.class, value);
        assertEquals(List.of("HW"), value.asList());
    }

    @Test
    @DisplayName("Non-string scalars should be converted to strings")
    void numberBecomesString() {
        assertEquals(CustomFieldValue.single("42"), CustomFieldValue.fromRaw(42));
        assertEquals(CustomFieldValue.single("true"), CustomFieldValue.fromRaw(true));
    }

    @Test
    @DisplayName("A collection should become a multiple value")
    void collectionBecomesMultiple() {
        CustomFieldValue value = CustomFieldValue.fromRaw(List.of("Backend", 7));

        assertInstanceOf(CustomFieldValue.Multiple.class, value);
        assertEquals(List.of("Backend", "7"), value.asList());
        assertInstanceOf(CustomFieldValue.Multiple.class, CustomFieldValue.fromRaw(Set.of("x")));
    }

    @Test
    @DisplayName("A null raw value should be rejected")
    void nullRejected() {
        assertThrows(NullPointerException.class, () -> CustomFieldValue.fromRaw(null));
    }

    @Test
    @DisplayName("map should keep the variant")
    void mapKeepsVariant() {
        assertEquals(CustomFieldValue.single("HW"), CustomFieldValue.single("hw").map(String::toUpperCase));
        assertEquals(CustomFieldValue.multiple(List.of("A", "B")),
                CustomFieldValue.multiple(List.of("a", "b")).map(String::toUpperCase));
    }

    @Test
    @DisplayName("A multiple value should not change when its source list does")
    void multipleCopiesInput() {
        List<String> source = new ArrayList<>(List.of("a"));
        CustomFieldValue value = CustomFieldValue.multiple(source);
        source.add("b");

        assertEquals(List.of("a"), value.asList());
    }
}
