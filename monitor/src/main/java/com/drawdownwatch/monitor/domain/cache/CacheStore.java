package com.drawdownwatch.monitor.domain.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * String key/value store with per-entry expiry. Implementations throw
 * {@link com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException} when the backing
 * store cannot be reached; a missing or expired key is an empty result, never an error.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(Collection<String> keys);

    /** Removes every key starting with {@code prefix}; cost is proportional to the matching keys. */
    long deleteByPrefix(String prefix);

    long countByPrefix(String prefix);

    boolean isAvailable();
}
