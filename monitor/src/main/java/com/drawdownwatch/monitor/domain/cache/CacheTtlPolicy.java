package com.drawdownwatch.monitor.domain.cache;

import com.drawdownwatch.common.market.Timeframe;

import java.time.Duration;

public record CacheTtlPolicy(
        Duration currentSnapshot,
        Duration latest,
        Duration historyDay,
        Duration historyWeek,
        Duration historyLongTerm,
        Duration recentSeries,
        Duration marketStatus,
        int recentSeriesSize) {

    public static CacheTtlPolicy defaults() {
        return new CacheTtlPolicy(
                Duration.ofHours(72),
                Duration.ofHours(24),
                Duration.ofHours(1),
                Duration.ofHours(6),
                Duration.ofHours(24),
                Duration.ofMinutes(15),
                Duration.ofSeconds(60),
                100);
    }

    public Duration history(Timeframe timeframe) {
        return switch (timeframe) {
            case ONE_DAY -> historyDay;
            case ONE_WEEK -> historyWeek;
            case ONE_MONTH, THREE_MONTHS, SIX_MONTHS, ONE_YEAR -> historyLongTerm;
        };
    }
}
