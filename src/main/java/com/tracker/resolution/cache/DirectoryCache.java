package com.tracker.resolution.cache;

import java.util.List;
import java.util.function.Supplier;

/**
 * Instance-scoped cache of directory lists, keyed by {@link DirectoryKey}.
 * A list is loaded at most once per cache; a failed load is not cached.
 *
 * <p>Owned by exactly one resolver. Never share an instance between callers
 * with different identities.</p>
 */
public interface DirectoryCache {

    /**
     * Returns the cached list for the key, loading it on first access.
     *
     * @param key    directory key
     * @param loader fetches the list; exceptions propagate unchanged
     * @return an immutable list
     */
    <T> List<T> get(DirectoryKey key, Supplier<List<T>> loader);

    /**
     * Returns true if the list for the key is already cached.
     */
    boolean contains(DirectoryKey key);

    /**
     * Drops every cached list.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
