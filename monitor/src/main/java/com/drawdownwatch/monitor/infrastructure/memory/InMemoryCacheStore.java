package com.drawdownwatch.monitor.infrastructure.memory;

import com.drawdownwatch.monitor.domain.cache.CacheStore;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local cache store on an ordered map; prefix operations walk only the matching key range.
 * Expired entries are dropped lazily when they are read or counted.
 */
@RequiredArgsConstructor
public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentNavigableMap<String, Entry> entries = new ConcurrentSkipListMap<>();
    private final Clock clock;

    @Override
    public Optional<String> get(String key) {
        var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(Collection<String> keys) {
        keys.forEach(entries::remove);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        var range = range(prefix);
        long removed = range.size();
        range.clear();
        return removed;
    }

    @Override
    public long countByPrefix(String prefix) {
        var now = clock.instant();
        return range(prefix).values().stream().filter(entry -> !entry.isExpired(now)).count();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private ConcurrentNavigableMap<String, Entry> range(String prefix) {
        return entries.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
    }

    record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
