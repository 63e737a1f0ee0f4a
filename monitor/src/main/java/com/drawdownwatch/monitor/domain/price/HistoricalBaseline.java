package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Price of a symbol at a fixed lookback. A {@code null} price means no daily close was found
 * within the tolerance window of the target date, which is not the same as a zero price.
 */
public record HistoricalBaseline(String symbol, Market market, Timeframe timeframe, BigDecimal price) {

    public static HistoricalBaseline of(String symbol, Market market, Timeframe timeframe, BigDecimal price) {
        return new HistoricalBaseline(symbol, market, timeframe, price);
    }

    public static HistoricalBaseline absent(String symbol, Market market, Timeframe timeframe) {
        return new HistoricalBaseline(symbol, market, timeframe, null);
    }

    /** Fills every timeframe missing from {@code partial} with an absent baseline. */
    public static Map<Timeframe, HistoricalBaseline> allTimeframes(
            String symbol, Market market, Map<Timeframe, HistoricalBaseline> partial) {
        var baselines = new EnumMap<Timeframe, HistoricalBaseline>(Timeframe.class);
        for (var timeframe : Timeframe.values()) {
            baselines.put(timeframe, partial.getOrDefault(timeframe, absent(symbol, market, timeframe)));
        }
        return baselines;
    }

    public boolean isPresent() {
        return price != null;
    }

    public Optional<BigDecimal> value() {
        return Optional.ofNullable(price);
    }
}
