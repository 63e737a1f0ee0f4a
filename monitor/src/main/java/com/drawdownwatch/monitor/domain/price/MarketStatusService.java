package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@RequiredArgsConstructor
public class MarketStatusService {

    private final TieredPriceCache cache;
    private final Clock clock;

    public MarketStatus status(Market market) {
        return cache.marketStatus(market).orElseGet(() -> {
            var now = clock.instant();
            var status = new MarketStatus(market, market.isTradingHours(now), now);
            cache.putMarketStatus(status);
            return status;
        });
    }

    public boolean isOpen(Market market) {
        return status(market).open();
    }
}
