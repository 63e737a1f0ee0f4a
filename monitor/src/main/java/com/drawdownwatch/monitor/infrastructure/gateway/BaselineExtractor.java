package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.price.HistoricalBaseline;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the baseline of each timeframe out of a daily close series: the close nearest to
 * {@code today} minus the lookback, accepted only within {@value #TOLERANCE_DAYS} days of it.
 * Today's own bar is the live price, never a baseline.
 */
public class BaselineExtractor {

    static final int TOLERANCE_DAYS = 7;

    public Map<Timeframe, HistoricalBaseline> extract(
            String symbol, Market market, List<DailyClose> closes, LocalDate today) {
        var baselines = new EnumMap<Timeframe, HistoricalBaseline>(Timeframe.class);
        for (var timeframe : Timeframe.values()) {
            var target = today.minusDays(timeframe.lookbackDays());
            DailyClose nearest = null;
            long nearestDistance = Long.MAX_VALUE;
            for (var close : closes) {
                if (close.close() == null || close.close().signum() <= 0 || !close.date().isBefore(today)) {
                    continue;
                }
                var distance = Math.abs(ChronoUnit.DAYS.between(target, close.date()));
                if (distance < nearestDistance) {
                    nearest = close;
                    nearestDistance = distance;
                }
            }
            baselines.put(timeframe, nearest != null && nearestDistance <= TOLERANCE_DAYS
                    ? HistoricalBaseline.of(symbol, market, timeframe, nearest.close())
                    : HistoricalBaseline.absent(symbol, market, timeframe));
        }
        return baselines;
    }
}
