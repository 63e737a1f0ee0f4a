package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.price.PriceQuote;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One upstream price source. Both fetch methods throw
 * {@link com.drawdownwatch.monitor.domain.exceptions.UpstreamUnavailableException} when the source
 * cannot be reached or answers with something unreadable.
 */
public interface PriceProvider {

    String providerName();

    boolean supports(String symbol, Market market);

    Optional<PriceQuote> fetchCurrent(String symbol, Market market);

    /** Daily closes between {@code from} and {@code to} inclusive, oldest first. */
    List<DailyClose> fetchDailyCloses(String symbol, Market market, LocalDate from, LocalDate to);
}
