package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;

import java.util.Collection;
import java.util.Map;

/**
 * Upstream price capability. Both calls tolerate partial results: a symbol that could not be
 * fetched is missing from the returned map, and a baseline without data is absent.
 */
public interface PriceSourceGateway {

    Map<String, PriceQuote> getCurrent(Collection<String> symbols, Market market);

    Map<Timeframe, HistoricalBaseline> getHistorical(String symbol, Market market);
}
