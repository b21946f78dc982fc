package com.tracker.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Caffeine-backed directory cache without expiry.
 */
public class CaffeineDirectoryCache implements DirectoryCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDirectoryCache.class);

    private final Cache<DirectoryKey, List<?>> cache;

    public CaffeineDirectoryCache() {
        this(CacheConfig.defaults());
    }

    public CaffeineDirectoryCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.debug("CaffeineDirectoryCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> get(DirectoryKey key, Supplier<List<T>> loader) {
        // A loader exception leaves the mapping unset, so the next call fetches again
        return (List<T>) cache.get(key, k -> {
            List<T> loaded = loader.get();
            log.debug("directory.loaded kind={} projectId={} trackerId={} count={}",
                    k.kind(), k.projectId(), k.trackerId(), loaded.size());
            return List.copyOf(loaded);
        });
    }

    @Override
    public boolean contains(DirectoryKey key) {
        return cache.asMap().containsKey(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all directory entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                cache.estimatedSize()
        );
    }
}
