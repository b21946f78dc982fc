package com.tracker.resolution.rules;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.CustomFieldDefinitionFull;
import com.tracker.resolution.exception.AmbiguousMatchException;
import com.tracker.resolution.exception.ErrorKind;
import com.tracker.resolution.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomFieldRules Tests")
class CustomFieldRulesTest {

    private final CustomFieldRules rules = new CustomFieldRules(Map.of(
            "223", new CustomFieldRule("Category", List.of("SW Tool", "HW"), List.of(32)),
            "225", CustomFieldRule.freeText("Customer Reference"),
            "226", new CustomFieldRule("Root Cause", List.of("Code", "Configuration"), List.of(4, 32))));

    @Nested
    @DisplayName("Value validation")
    class ValueValidation {

        @Test
        @DisplayName("Should correct the spelling of a case-insensitive match")
        void correctsCase() {
            assertEquals("SW Tool", rules.validateValue(223, "sw tool"));
            assertEquals("HW", rules.validateValue(223, "hw"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"SW Tool", "sw tool", "SW TOOL", "HW", "hW"})
        @DisplayName("Validation should be idempotent")
        void idempotent(String value) {
            String once = rules.validateValue(223, value);
            assertEquals(once, rules.validateValue(223, once));
        }

        @Test
        @DisplayName("Should reject a value outside the allowed set and list the allowed values")
        void rejectsBogus() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> rules.validateValue(223, "bogus"));

            assertEquals(ErrorKind.VALIDATION, e.getKind());
            assertFalse(e.isMissingRequired());
            assertEquals("Category", e.getFieldName());
            assertEquals("invalid value \"bogus\" for Category (ID: 223). Valid values: SW Tool, HW", e.getMessage());
        }

        @Test
        @DisplayName("A field without rule or without values should accept anything")
        void unknownAndFreeTextPass() {
            assertEquals("whatever", rules.validateValue(999, "whatever"));
            assertEquals("PO-1234", rules.validateValue(225, "PO-1234"));
        }

        @Test
        @DisplayName("Should validate multi-select values element by element")
        void multipleValues() {
            assertEquals(List.of("Code", "Configuration"),
                    rules.validateValues(226, List.of("code", "CONFIGURATION")));
            assertThrows(ValidationException.class,
                    () -> rules.validateValues(226, List.of("Code", "Weather")));
        }

        @Test
        @DisplayName("Should keep the variant of a payload value")
        void keepsVariant() {
            assertEquals(CustomFieldValue.single("HW"), rules.validate(223, CustomFieldValue.single("hw")));
            assertEquals(CustomFieldValue.multiple(List.of("Code")),
                    rules.validate(226, CustomFieldValue.multiple(List.of("code"))));
        }
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        @DisplayName("Should report a required field that is not supplied")
        void reportsMissing() {
            CustomFieldRules single = new CustomFieldRules(Map.of(
                    "223", new CustomFieldRule("Category", List.of("SW Tool", "HW"), List.of(32))));

            assertEquals(List.of(223), single.requiredFieldsMissing(32, Set.of()).stream()
                    .map(RequiredField::fieldId).toList());
            assertTrue(single.requiredFieldsMissing(32, Set.of(223)).isEmpty());
        }

        @Test
        @DisplayName("Tracker 0 should never require anything")
        void trackerZero() {
            assertTrue(rules.requiredFieldsMissing(0, Set.of()).isEmpty());
            assertDoesNotThrow(() -> rules.requireFields(0, Set.of()));
        }

        @Test
        @DisplayName("Missing fields should be ordered by ID")
        void orderedById() {
            List<RequiredField> missing = rules.requiredFieldsMissing(32, Set.of());

            assertEquals(List.of(223, 226), missing.stream().map(RequiredField::fieldId).toList());
            assertEquals(List.of("SW Tool", "HW"), missing.get(0).allowedValues());
        }

        @Test
        @DisplayName("requireFields should name every missing field")
        void requireFieldsThrows() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> rules.requireFields(32, Set.of(226)));

            assertTrue(e.isMissingRequired());
            assertNull(e.getFieldId());
            assertEquals(1, e.getMissingFields().size());
            assertEquals("required custom field(s) missing: Category (ID: 223, values: SW Tool, HW)", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Merge and generation")
    class MergeAndGeneration {

        @Test
        @DisplayName("Generated rules should replace curated rules per field")
        void mergeReplacesPerField() {
            CustomFieldRules curated = new CustomFieldRules(Map.of(
                    "1", CustomFieldRule.of("Field One", List.of("old")),
                    "2", CustomFieldRule.of("Field Two", List.of("keep"))));
            CustomFieldRules generated = new CustomFieldRules(Map.of(
                    "1", CustomFieldRule.of("Field One", List.of("new"))));

            CustomFieldRules merged = CustomFieldRules.merge(curated, generated);

            assertEquals(2, merged.size());
            assertEquals(List.of("new"), merged.getRule(1).orElseThrow().values());
            assertEquals(List.of("keep"), merged.getRule(2).orElseThrow().values());
        }

        @Test
        @DisplayName("Merging with an empty side should return the other side")
        void mergeWithEmpty() {
            assertSame(rules, CustomFieldRules.merge(rules, CustomFieldRules.empty()));
            assertSame(rules, CustomFieldRules.merge(CustomFieldRules.empty(), rules));
            assertTrue(CustomFieldRules.merge(null, null).isEmpty());
        }

        @Test
        @DisplayName("Should build rules from issue field definitions only")
        void fromDefinitions() {
            List<CustomFieldDefinitionFull> definitions = List.of(
                    new CustomFieldDefinitionFull(223, "Category", "issue", "list", true, false,
                            List.of("SW Tool", "HW"), List.of(new Candidate(32, "Change Request")), null),
                    new CustomFieldDefinitionFull(230, "Notes", "issue", "text", true, false,
                            List.of(), List.of(), null),
                    new CustomFieldDefinitionFull(400, "Department", "user", "list", false, false,
                            List.of("R&D"), List.of(), null));

            CustomFieldRules generated = CustomFieldRules.fromDefinitions(definitions);

            assertEquals(2, generated.size());
            assertTrue(generated.getRule(400).isEmpty());
            assertEquals(List.of(32), generated.getRule(223).orElseThrow().requiredByTrackers());
            assertTrue(generated.getRule(230).orElseThrow().requiredByTrackers().isEmpty());
            assertTrue(generated.getRule(230).orElseThrow().freeTextOnly());
        }

        @Test
        @DisplayName("Should reject non-numeric field IDs")
        void rejectsNonNumericKeys() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CustomFieldRules(Map.of("category", CustomFieldRule.freeText("Category"))));
        }
    }

    @Nested
    @DisplayName("Name lookup")
    class NameLookup {

        @Test
        @DisplayName("Should find a field ID by exact name ignoring case")
        void findsByName() {
            assertEquals(223, rules.findFieldIdByName("CATEGORY").orElseThrow());
            assertTrue(rules.findFieldIdByName("Cat").isEmpty());
        }

        @Test
        @DisplayName("Should raise Ambiguous when two rules share a name")
        void duplicateNames() {
            CustomFieldRules duplicated = new CustomFieldRules(Map.of(
                    "1", CustomFieldRule.freeText("Area"),
                    "2", CustomFieldRule.freeText("area")));

            AmbiguousMatchException e = assertThrows(AmbiguousMatchException.class,
                    () -> duplicated.findFieldIdByName("Area"));
            assertEquals(2, e.getCandidates().size());
        }
    }
}
