package com.tracker.resolution.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracker.resolution.rules.CustomFieldRules;
import com.tracker.resolution.workflow.WorkflowRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves the persisted rule artifacts as JSON.
 *
 * <p>Both artifacts are optional. A missing file yields an empty rule set,
 * which leaves validation unconstrained. A file that exists but cannot be
 * parsed is an error.</p>
 *
 * <pre>
 * {"fields": {"223": {"name": "Category", "values": ["SW Tool", "HW"], "required_by_trackers": [32]}}}
 *
 * {"trackers": {"4": {"name": "Bug",
 *                     "statuses": {"6": {"name": "Rejected", "is_closed": true}},
 *                     "transitions": {"6": [9]}}}}
 * </pre>
 */
public final class RuleFiles {
    private static final Logger log = LoggerFactory.getLogger(RuleFiles.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private RuleFiles() {
        // Utility class
    }

    /**
     * Loads custom field rules, or returns an empty rule set if the file does not exist.
     *
     * @throws RuleFileException if the file cannot be read or parsed
     */
    public static CustomFieldRules loadCustomFieldRules(Path path) {
        if (!Files.exists(path)) {
            log.info("rules.file.absent type=custom-fields path={}", path);
            return CustomFieldRules.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            CustomFieldRules rules = readCustomFieldRules(in);
            log.info("rules.file.loaded type=custom-fields path={} fields={}", path, rules.size());
            return rules;
        } catch (IOException | IllegalArgumentException e) {
            throw new RuleFileException(path, "failed to load custom field rules", e);
        }
    }

    /**
     * Loads workflow rules, or returns an empty rule set if the file does not exist.
     *
     * @throws RuleFileException if the file cannot be read or parsed
     */
    public static WorkflowRules loadWorkflowRules(Path path) {
        if (!Files.exists(path)) {
            log.info("rules.file.absent type=workflow path={}", path);
            return WorkflowRules.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            WorkflowRules rules = readWorkflowRules(in);
            log.info("rules.file.loaded type=workflow path={} trackers={}", path, rules.size());
            return rules;
        } catch (IOException | IllegalArgumentException e) {
            throw new RuleFileException(path, "failed to load workflow rules", e);
        }
    }

    public static CustomFieldRules readCustomFieldRules(InputStream in) throws IOException {
        CustomFieldRulesDocument document = MAPPER.readValue(in, CustomFieldRulesDocument.class);
        if (document == null || document.fields() == null) {
            return CustomFieldRules.empty();
        }
        return new CustomFieldRules(document.fields());
    }

    public static WorkflowRules readWorkflowRules(InputStream in) throws IOException {
        WorkflowRulesDocument document = MAPPER.readValue(in, WorkflowRulesDocument.class);
        if (document == null || document.trackers() == null) {
            return WorkflowRules.empty();
        }
        return new WorkflowRules(document.trackers());
    }

    /**
     * Saves custom field rules, replacing the file.
     *
     * @throws RuleFileException if the file cannot be written
     */
    public static void writeCustomFieldRules(Path path, CustomFieldRules rules) {
        write(path, new CustomFieldRulesDocument(rules.getFields()), "custom field rules");
        log.info("rules.file.written type=custom-fields path={} fields={}", path, rules.size());
    }

    /**
     * Saves workflow rules, replacing the file.
     *
     * @throws RuleFileException if the file cannot be written
     */
    public static void writeWorkflowRules(Path path, WorkflowRules rules) {
        write(path, new WorkflowRulesDocument(rules.getTrackers()), "workflow rules");
        log.info("rules.file.written type=workflow path={} trackers={}", path, rules.size());
    }

    private static void write(Path path, Object document, String description) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), document);
        } catch (IOException e) {
            throw new RuleFileException(path, "failed to write " + description, e);
        }
    }
}
