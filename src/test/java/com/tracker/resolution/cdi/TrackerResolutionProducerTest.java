package com.tracker.resolution.cdi;

import com.tracker.resolution.api.ResolverConfig;
import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.core.model.MatchOutcome;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.MicrometerMetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import com.tracker.resolution.rules.CustomFieldRules;
import com.tracker.resolution.workflow.WorkflowRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrackerResolutionProducer Tests")
class TrackerResolutionProducerTest {

    @TempDir
    Path tempDir;

    private TrackerResolutionProducer producer;

    @BeforeEach
    void setUp() {
        producer = new TrackerResolutionProducer();
        producer.customFieldsFile = tempDir.resolve("custom_field_rules.json").toString();
        producer.workflowFile = tempDir.resolve("workflow_rules.json").toString();
        producer.miningPerTracker = 50;
        producer.projectLimit = 1000;
        producer.membershipLimit = 1000;
        producer.cacheMaxSize = 10_000;
        producer.metricsEnabled = true;
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(TrackerResolutionProducerTest.class.getResource("/rules/" + name).toURI()).toString();
    }

    @Test
    @DisplayName("Should load configured rule files")
    void loadsRuleFiles() throws Exception {
        producer.customFieldsFile = fixture("custom_field_rules.json");
        producer.workflowFile = fixture("workflow_rules.json");

        CustomFieldRules fieldRules = producer.customFieldRules();
        WorkflowRules workflowRules = producer.workflowRules();

        assertEquals(4, fieldRules.size());
        assertEquals(2, workflowRules.size());
    }

    @Test
    @DisplayName("Absent rule files should produce empty rule sets")
    void absentFiles() {
        assertTrue(producer.customFieldRules().isEmpty());
        assertTrue(producer.workflowRules().isEmpty());
    }

    @Test
    @DisplayName("Should build the resolver configuration from properties")
    void resolverConfig() {
        producer.projectLimit = 200;
        producer.membershipLimit = 300;
        producer.cacheMaxSize = 500;

        ResolverConfig config = producer.resolverConfig();

        assertEquals(200, config.getProjectLimit());
        assertEquals(300, config.getMembershipLimit());
        assertEquals(500, config.getCacheConfig().maxSize());
        assertEquals(50, producer.miningOptions().perTracker());
    }

    @Test
    @DisplayName("Should fall back to a simple registry without a container registry")
    void metricsEnabled() {
        MetricsService metrics = producer.metricsService();

        assertInstanceOf(MicrometerMetricsService.class, metrics);
        assertDoesNotThrow(() -> metrics.recordResolution(EntityKind.TRACKER, MatchOutcome.EXACT));
    }

    @Test
    @DisplayName("Should produce a no-op service when metrics are disabled")
    void metricsDisabled() {
        producer.metricsEnabled = false;

        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
    }
}
