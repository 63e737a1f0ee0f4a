package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineReadService {

    private final TieredPriceCache cache;
    private final PriceSourceGateway gateway;

    /**
     * Baselines for every timeframe. Served from the history tier when all timeframes are cached,
     * otherwise fetched live and written back. Upstream failure yields absent baselines.
     */
    public Map<Timeframe, HistoricalBaseline> baselines(String symbol, Market market) {
        var cached = cache.baselines(market, symbol);
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            var fetched = HistoricalBaseline.allTimeframes(symbol, market, gateway.getHistorical(symbol, market));
            fetched.values().forEach(cache::putBaseline);
            return fetched;
        } catch (RuntimeException e) {
            log.warn("Historical prices for {} ({}) unavailable: {}", symbol, market, e.getMessage());
            return HistoricalBaseline.allTimeframes(symbol, market, Map.of());
        }
    }
}
