package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the price cache. Answers from the cache tiers in order and only goes to the
 * upstream gateway when every tier misses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceReadService {

    private final TieredPriceCache cache;
    private final PriceSourceGateway gateway;

    /** Snapshot, then latest tier, then a live fetch that is written back to the latest tier. */
    public Optional<PriceQuote> currentPrice(String symbol, Market market) {
        var cached = cachedPrice(symbol, market);
        if (cached.isPresent()) {
            return cached;
        }
        log.debug("No cached price for {} ({}), fetching live", symbol, market);
        var live = Optional.ofNullable(gateway.getCurrent(List.of(symbol), market).get(symbol));
        live.ifPresent(cache::putLatest);
        return live;
    }

    /** Snapshot, then latest tier. Never calls upstream. */
    public Optional<PriceQuote> cachedPrice(String symbol, Market market) {
        var fromSnapshot = cache.snapshot(market).get(symbol);
        if (fromSnapshot != null) {
            return Optional.of(fromSnapshot);
        }
        return cache.latest(market, symbol);
    }

    public Map<String, PriceQuote> currentPrices(Market market) {
        return cache.snapshot(market);
    }

    public List<PricePoint> recentSeries(String symbol, Market market, int limit) {
        return cache.recent(market, symbol, limit);
    }
}
