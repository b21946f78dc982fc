package com.tracker.resolution.rules;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.CustomFieldDefinitionFull;
import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.exception.AmbiguousMatchException;
import com.tracker.resolution.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable set of custom field rules, keyed by field ID.
 *
 * <p>Validation is lenient where no rule is known: a field without a rule, or
 * with an empty value set, accepts any value. A value that matches an allowed
 * value ignoring case is corrected to the canonical spelling.</p>
 *
 * <pre>
 * CustomFieldRules rules = CustomFieldRules.merge(curated, CustomFieldRules.fromDefinitions(definitions));
 * String category = rules.validateValue(223, "sw tool");   // "SW Tool"
 * rules.requireFields(32, Set.of(223));
 * </pre>
 */
public final class CustomFieldRules {
    private static final Logger log = LoggerFactory.getLogger(CustomFieldRules.class);

    private static final CustomFieldRules EMPTY = new CustomFieldRules(Map.of());

    private final Map<String, CustomFieldRule> fields;

    public CustomFieldRules(Map<String, CustomFieldRule> fields) {
        Map<String, CustomFieldRule> copy = new LinkedHashMap<>();
        fields.forEach((id, rule) -> {
            parseFieldId(id);
            copy.put(id, rule);
        });
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a rule set without any rule; every value passes.
     */
    public static CustomFieldRules empty() {
        return EMPTY;
    }

    /**
     * Builds rules from the privileged field listing. Only issue fields are
     * included. A field that is required and scoped to trackers is marked
     * required for those trackers; a required field without tracker scoping
     * cannot be tied to a tracker and is left optional.
     */
    public static CustomFieldRules fromDefinitions(List<CustomFieldDefinitionFull> definitions) {
        Map<String, CustomFieldRule> generated = new LinkedHashMap<>();
        for (CustomFieldDefinitionFull definition : definitions) {
            if (!definition.isIssueField()) {
                continue;
            }
            List<Integer> requiredBy = List.of();
            if (definition.required() && !definition.trackers().isEmpty()) {
                requiredBy = definition.trackers().stream().map(Candidate::id).toList();
            }
            generated.put(String.valueOf(definition.id()),
                    new CustomFieldRule(definition.name(), definition.possibleValues(), requiredBy));
        }
        log.info("rules.generated fields={} definitions={}", generated.size(), definitions.size());
        return new CustomFieldRules(generated);
    }

    /**
     * Merges two rule sets. A field present in {@code generated} replaces the
     * curated rule entirely (no union of value sets); fields present only in
     * {@code curated} are kept.
     */
    public static CustomFieldRules merge(CustomFieldRules curated, CustomFieldRules generated) {
        if (generated == null || generated.isEmpty()) {
            return curated != null ? curated : EMPTY;
        }
        if (curated == null || curated.isEmpty()) {
            return generated;
        }
        Map<String, CustomFieldRule> merged = new LinkedHashMap<>(curated.fields);
        merged.putAll(generated.fields);
        return new CustomFieldRules(merged);
    }

    /**
     * Validates a value and returns it in canonical spelling.
     *
     * @throws ValidationException if the field has a value set and the value is not in it
     */
    public String validateValue(int fieldId, String value) {
        Objects.requireNonNull(value, "value is required");
        CustomFieldRule rule = fields.get(String.valueOf(fieldId));
        if (rule == null || rule.freeTextOnly()) {
            return value;
        }
        if (rule.values().contains(value)) {
            return value;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String allowed : rule.values()) {
            if (allowed.toLowerCase(Locale.ROOT).equals(lower)) {
                log.debug("rules.corrected fieldId={} value='{}' canonical='{}'", fieldId, value, allowed);
                return allowed;
            }
        }
        throw ValidationException.invalidValue(fieldId, rule.name(), value, rule.values());
    }

    /**
     * Validates every element of a multi-select value, failing on the first
     * invalid element.
     */
    public List<String> validateValues(int fieldId, List<String> values) {
        List<String> corrected = new ArrayList<>(values.size());
        for (String value : values) {
            corrected.add(validateValue(fieldId, value));
        }
        return corrected;
    }

    /**
     * Validates a single or multi-select payload value.
     */
    public CustomFieldValue validate(int fieldId, CustomFieldValue value) {
        return value.map(v -> validateValue(fieldId, v));
    }

    /**
     * Returns the fields required for the tracker that are not supplied,
     * ordered by field ID. A tracker ID of 0 or less yields an empty list.
     */
    public List<RequiredField> requiredFieldsMissing(int trackerId, Set<Integer> suppliedFieldIds) {
        if (trackerId <= 0) {
            return List.of();
        }
        List<RequiredField> missing = new ArrayList<>();
        fields.forEach((id, rule) -> {
            int fieldId = parseFieldId(id);
            if (rule.requiredFor(trackerId) && !suppliedFieldIds.contains(fieldId)) {
                missing.add(new RequiredField(fieldId, rule.name(), rule.values()));
            }
        });
        missing.sort(Comparator.comparingInt(RequiredField::fieldId));
        return missing;
    }

    /**
     * Checks required fields for the tracker.
     *
     * @throws ValidationException naming every missing field
     */
    public void requireFields(int trackerId, Set<Integer> suppliedFieldIds) {
        List<RequiredField> missing = requiredFieldsMissing(trackerId, suppliedFieldIds);
        if (!missing.isEmpty()) {
            throw ValidationException.missingRequired(missing);
        }
    }

    /**
     * Finds a field ID by case-insensitive exact rule name.
     *
     * @throws AmbiguousMatchException if several rules carry the name
     */
    public OptionalInt findFieldIdByName(String name) {
        String query = name.toLowerCase(Locale.ROOT);
        List<Candidate> matches = new ArrayList<>();
        fields.forEach((id, rule) -> {
            if (rule.name().toLowerCase(Locale.ROOT).equals(query)) {
                matches.add(new Candidate(parseFieldId(id), rule.name()));
            }
        });
        if (matches.size() > 1) {
            throw new AmbiguousMatchException(EntityKind.CUSTOM_FIELD, name, matches);
        }
        return matches.isEmpty() ? OptionalInt.empty() : OptionalInt.of(matches.get(0).id());
    }

    public Optional<CustomFieldRule> getRule(int fieldId) {
        return Optional.ofNullable(fields.get(String.valueOf(fieldId)));
    }

    public Map<String, CustomFieldRule> getFields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static int parseFieldId(String id) {
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("custom field ID must be numeric: " + id, e);
        }
    }

    @Override
    public String toString() {
        return "CustomFieldRules{fields=" + fields.size() + '}';
    }
}
