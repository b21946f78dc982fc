package com.tracker.resolution.cache;

/**
 * Configuration for the directory cache. Entries never expire; the bound only
 * guards against unbounded growth of per-project membership lists.
 *
 * @param maxSize maximum number of cached directory lists
 */
public record CacheConfig(int maxSize) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 directory lists.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000);
    }
}
