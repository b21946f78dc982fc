package com.tracker.resolution.workflow;

/**
 * Options for workflow mining.
 *
 * @param perTracker maximum number of issues sampled per tracker
 * @param pageSize   maximum page size of one issue search
 */
public record MiningOptions(int perTracker, int pageSize) {

    public static final int DEFAULT_PER_TRACKER = 50;
    public static final int DEFAULT_PAGE_SIZE = 100;

    public MiningOptions {
        if (perTracker <= 0) {
            throw new IllegalArgumentException("perTracker must be > 0");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
    }

    public static MiningOptions defaults() {
        return new MiningOptions(DEFAULT_PER_TRACKER, DEFAULT_PAGE_SIZE);
    }

    public static MiningOptions perTracker(int perTracker) {
        return new MiningOptions(perTracker, DEFAULT_PAGE_SIZE);
    }
}
