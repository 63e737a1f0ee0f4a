package com.drawdownwatch.monitor.domain.cache;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Key layout of the price cache. Every key of a market starts with {@link #marketPrefix(Market)}
 * so dropping a market is a single prefix operation. Alert tracking keys sit outside
 * that prefix.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CacheKeys {

    private static final String SEPARATOR = ":";
    private static final String ALERT_TRACKING = "alert-tracking";

    public static String marketPrefix(Market market) {
        return market.name() + SEPARATOR;
    }

    public static String currentSnapshot(Market market) {
        return marketPrefix(market) + CacheTier.CURRENT_SNAPSHOT.segment();
    }

    public static String latest(Market market, String symbol) {
        return marketPrefix(market) + CacheTier.LATEST.segment() + SEPARATOR + symbol;
    }

    public static String history(Market market, String symbol, Timeframe timeframe) {
        return marketPrefix(market) + CacheTier.HISTORY.segment() + SEPARATOR + symbol + SEPARATOR + timeframe.code();
    }

    public static String recent(Market market, String symbol) {
        return marketPrefix(market) + CacheTier.RECENT.segment() + SEPARATOR + symbol;
    }

    public static String marketStatus(Market market) {
        return marketPrefix(market) + CacheTier.MARKET_STATUS.segment();
    }

    public static String alertTracking(Market market, String symbol) {
        return ALERT_TRACKING + SEPARATOR + market.name() + SEPARATOR + symbol;
    }

    /** Every per-symbol key of one symbol, across all tiers. */
    public static List<String> symbolKeys(Market market, String symbol) {
        var keys = new ArrayList<String>();
        keys.add(latest(market, symbol));
        keys.add(recent(market, symbol));
        for (var timeframe : Timeframe.values()) {
            keys.add(history(market, symbol, timeframe));
        }
        return keys;
    }
}
