package com.drawdownwatch.monitor.domain.cache;

import com.drawdownwatch.common.json.JacksonConfig;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException;
import com.drawdownwatch.monitor.domain.price.HistoricalBaseline;
import com.drawdownwatch.monitor.domain.price.MarketStatus;
import com.drawdownwatch.monitor.domain.price.PricePoint;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Price cache with one tier per kind of data and a TTL per tier.
 *
 * <p>No method throws on store failure: an unreachable store reads as a miss and a failed write is
 * logged and dropped. The market snapshot is serialized as one value and written with one
 * {@code set}, so a reader sees either the previous snapshot or the new one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TieredPriceCache {

    /** Marks a baseline that was looked up and found absent. */
    private static final String ABSENT = "";

    private final CacheStore store;
    private final CacheTtlPolicy ttl;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public Map<String, PriceQuote> snapshot(Market market) {
        return read(CacheKeys.currentSnapshot(market), Snapshot.class)
                .map(snapshot -> {
                    var quotes = new LinkedHashMap<String, PriceQuote>();
                    snapshot.quotes().forEach(quote -> quotes.put(quote.symbol(), quote));
                    return Collections.unmodifiableMap(quotes);
                })
                .orElse(Map.of());
    }

    public void replaceSnapshot(Market market, Map<String, PriceQuote> quotes) {
        write(CacheKeys.currentSnapshot(market), new Snapshot(List.copyOf(quotes.values())), ttl.currentSnapshot());
    }

    public Optional<PriceQuote> latest(Market market, String symbol) {
        return read(CacheKeys.latest(market, symbol), PriceQuote.class);
    }

    public void putLatest(PriceQuote quote) {
        write(CacheKeys.latest(quote.market(), quote.symbol()), quote, ttl.latest());
    }

    public Optional<HistoricalBaseline> baseline(Market market, String symbol, Timeframe timeframe) {
        return readRaw(CacheKeys.history(market, symbol, timeframe))
                .map(raw -> raw.equals(ABSENT)
                        ? HistoricalBaseline.absent(symbol, market, timeframe)
                        : HistoricalBaseline.of(symbol, market, timeframe, new BigDecimal(raw)));
    }

    /** All six baselines of a symbol, or empty when any one of them is not cached. */
    public Optional<Map<Timeframe, HistoricalBaseline>> baselines(Market market, String symbol) {
        var baselines = new EnumMap<Timeframe, HistoricalBaseline>(Timeframe.class);
        for (var timeframe : Timeframe.values()) {
            var cached = baseline(market, symbol, timeframe);
            if (cached.isEmpty()) {
                return Optional.empty();
            }
            baselines.put(timeframe, cached.get());
        }
        return Optional.of(baselines);
    }

    public void putBaseline(HistoricalBaseline baseline) {
        var value = baseline.value().map(BigDecimal::toPlainString).orElse(ABSENT);
        writeRaw(CacheKeys.history(baseline.market(), baseline.symbol(), baseline.timeframe()),
                value, ttl.history(baseline.timeframe()));
    }

    /** Newest first, at most {@code limit} points. */
    public List<PricePoint> recent(Market market, String symbol, int limit) {
        var points = read(CacheKeys.recent(market, symbol), RecentSeries.class)
                .map(RecentSeries::points)
                .orElse(List.of());
        return points.size() <= limit ? points : points.subList(0, limit);
    }

    public void appendRecent(PriceQuote quote) {
        var current = recent(quote.market(), quote.symbol(), ttl.recentSeriesSize());
        var points = new ArrayList<PricePoint>(current.size() + 1);
        points.add(PricePoint.from(quote));
        points.addAll(current.subList(0, Math.min(current.size(), ttl.recentSeriesSize() - 1)));
        write(CacheKeys.recent(quote.market(), quote.symbol()), new RecentSeries(points), ttl.recentSeries());
    }

    public Optional<MarketStatus> marketStatus(Market market) {
        return read(CacheKeys.marketStatus(market), MarketStatus.class);
    }

    public void putMarketStatus(MarketStatus status) {
        write(CacheKeys.marketStatus(status.market()), status, ttl.marketStatus());
    }

    public void invalidate(Market market) {
        try {
            var removed = store.deleteByPrefix(CacheKeys.marketPrefix(market));
            log.info("Invalidated {} cache keys for {}", removed, market);
        } catch (CacheUnavailableException e) {
            log.warn("Cache invalidation for {} dropped: {}", market, e.getMessage());
        }
    }

    public void invalidate(Market market, String symbol) {
        try {
            store.delete(CacheKeys.symbolKeys(market, symbol));
            log.debug("Invalidated cache keys of {} ({})", symbol, market);
        } catch (CacheUnavailableException e) {
            log.warn("Cache invalidation for {} ({}) dropped: {}", symbol, market, e.getMessage());
        }
    }

    public CacheStats stats(Market market) {
        try {
            var connected = store.isAvailable();
            if (!connected) {
                return new CacheStats(market, false, false, 0);
            }
            var snapshotCached = store.get(CacheKeys.currentSnapshot(market)).isPresent();
            return new CacheStats(market, true, snapshotCached, store.countByPrefix(CacheKeys.marketPrefix(market)));
        } catch (CacheUnavailableException e) {
            log.warn("Cache stats for {} unavailable: {}", market, e.getMessage());
            return new CacheStats(market, false, false, 0);
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        return readRaw(key).flatMap(raw -> {
            try {
                return Optional.of(objectMapper.readValue(raw, type));
            } catch (JacksonException e) {
                log.warn("Discarding unreadable cache value at {}: {}", key, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    private Optional<String> readRaw(String key) {
        try {
            var value = store.get(key);
            log.debug("Cache {} for {}", value.isPresent() ? "hit" : "miss", key);
            return value;
        } catch (CacheUnavailableException e) {
            log.warn("Cache read of {} degraded to miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration expiry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            log.error("Cannot serialize cache value for {}", key, e);
            return;
        }
        writeRaw(key, json, expiry);
    }

    private void writeRaw(String key, String value, Duration expiry) {
        try {
            store.set(key, value, expiry);
        } catch (CacheUnavailableException e) {
            log.warn("Cache write of {} dropped: {}", key, e.getMessage());
        }
    }

    public record Snapshot(List<PriceQuote> quotes) {}

    public record RecentSeries(List<PricePoint> points) {}
}
