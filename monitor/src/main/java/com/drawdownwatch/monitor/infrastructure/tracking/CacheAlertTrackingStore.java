package com.drawdownwatch.monitor.infrastructure.tracking;

import com.drawdownwatch.common.json.JacksonConfig;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.CacheKeys;
import com.drawdownwatch.monitor.domain.cache.CacheStore;
import com.drawdownwatch.monitor.domain.cooldown.AlertTrackingState;
import com.drawdownwatch.monitor.domain.cooldown.AlertTrackingStore;
import com.drawdownwatch.monitor.domain.cooldown.CooldownPolicy;
import com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException;
import com.drawdownwatch.monitor.domain.exceptions.TrackingStoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Keeps alert tracking state in the cache store, outside the market key prefix, with the
 * cooldown policy's TTL. An entry that has expired simply means no alert was raised recently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheAlertTrackingStore implements AlertTrackingStore {

    private final CacheStore cacheStore;
    private final CooldownPolicy policy;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @Override
    public Optional<AlertTrackingState> find(Market market, String symbol) {
        var key = CacheKeys.alertTracking(market, symbol);
        try {
            return cacheStore.get(key).flatMap(json -> decode(key, json));
        } catch (CacheUnavailableException e) {
            throw TrackingStoreUnavailableException.of(key, e);
        }
    }

    @Override
    public void save(Market market, String symbol, AlertTrackingState state) {
        var key = CacheKeys.alertTracking(market, symbol);
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(state), policy.trackingTtl());
        } catch (CacheUnavailableException | JacksonException e) {
            throw TrackingStoreUnavailableException.of(key, e);
        }
    }

    private Optional<AlertTrackingState> decode(String key, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, AlertTrackingState.class));
        } catch (JacksonException e) {
            log.warn("Ignoring unreadable tracking state at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
