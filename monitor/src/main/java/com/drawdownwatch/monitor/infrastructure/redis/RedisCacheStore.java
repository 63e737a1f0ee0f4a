package com.drawdownwatch.monitor.infrastructure.redis;

import com.drawdownwatch.monitor.domain.cache.CacheStore;
import com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis backed cache store. Every key is also recorded in an index set named after its first
 * segment, so removing a prefix reads the index instead of scanning the keyspace.
 *
 * <p>Members whose key has expired on its own stay in the index until the prefix is counted or
 * deleted; both operations drop them.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    static final String INDEX_PREFIX = "key-index:";
    static final Duration INDEX_TTL = Duration.ofDays(7);

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw CacheUnavailableException.of("get", key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            var indexKey = indexKey(key);
            redisTemplate.opsForSet().add(indexKey, key);
            redisTemplate.expire(indexKey, INDEX_TTL);
        } catch (DataAccessException e) {
            throw CacheUnavailableException.of("set", key, e);
        }
    }

    @Override
    public void delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        try {
            redisTemplate.delete(keys);
        } catch (DataAccessException e) {
            throw CacheUnavailableException.of("delete", String.join(",", keys), e);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        try {
            var indexKey = indexKey(prefix);
            var matching = indexedKeys(indexKey, prefix);
            if (matching.isEmpty()) {
                return 0;
            }
            var deleted = redisTemplate.delete(matching);
            redisTemplate.opsForSet().remove(indexKey, matching.toArray());
            log.debug("Deleted {} of {} indexed keys under {}", deleted, matching.size(), prefix);
            return deleted == null ? 0 : deleted;
        } catch (DataAccessException e) {
            throw CacheUnavailableException.of("deleteByPrefix", prefix, e);
        }
    }

    @Override
    public long countByPrefix(String prefix) {
        try {
            var indexKey = indexKey(prefix);
            var present = 0L;
            var stale = new ArrayList<String>();
            for (var key : indexedKeys(indexKey, prefix)) {
                if (Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
                    present++;
                } else {
                    stale.add(key);
                }
            }
            if (!stale.isEmpty()) {
                redisTemplate.opsForSet().remove(indexKey, stale.toArray());
                log.debug("Pruned {} expired keys from {}", stale.size(), indexKey);
            }
            return present;
        } catch (DataAccessException e) {
            throw CacheUnavailableException.of("countByPrefix", prefix, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            redisTemplate.hasKey(INDEX_PREFIX + "probe");
            return true;
        } catch (DataAccessException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private List<String> indexedKeys(String indexKey, String prefix) {
        Set<String> members = redisTemplate.opsForSet().members(indexKey);
        if (members == null) {
            return List.of();
        }
        return members.stream().filter(member -> member.startsWith(prefix)).toList();
    }

    static String indexKey(String keyOrPrefix) {
        var end = keyOrPrefix.indexOf(':');
        return INDEX_PREFIX + (end < 0 ? keyOrPrefix : keyOrPrefix.substring(0, end));
    }
}
