package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Calendar date in a market's own time zone. Derived once per evaluation so every decision in a
 * pass agrees on what "today" is.
 */
public record MarketDate(Market market, LocalDate date) {

    public static MarketDate today(Market market, Clock clock) {
        return new MarketDate(market, market.localDate(clock.instant()));
    }

    public boolean isAfter(LocalDate other) {
        return date.isAfter(other);
    }

    public boolean isSameDay(LocalDate other) {
        return date.isEqual(other);
    }
}
