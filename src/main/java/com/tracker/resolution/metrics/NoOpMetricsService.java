package com.tracker.resolution.metrics;

import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.core.model.MatchOutcome;
import com.tracker.resolution.exception.ErrorKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. All methods are empty.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(EntityKind kind, MatchOutcome outcome) {
    }

    @Override
    public void recordDirectoryFetch(EntityKind kind, Duration duration) {
    }

    @Override
    public void incrementRuleViolation(ErrorKind kind) {
    }

    @Override
    public void recordMinedTracker(int issuesInspected, int transitionsFound) {
    }

    @Override
    public void incrementMiningFetchFailure() {
    }
}
