package com.tracker.resolution.metrics;

import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.core.model.MatchOutcome;
import com.tracker.resolution.exception.ErrorKind;

import java.time.Duration;

/**
 * Interface for recording resolution and validation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolution(EntityKind kind, MatchOutcome outcome);

    void recordDirectoryFetch(EntityKind kind, Duration duration);

    void incrementRuleViolation(ErrorKind kind);

    void recordMinedTracker(int issuesInspected, int transitionsFound);

    void incrementMiningFetchFailure();
}
