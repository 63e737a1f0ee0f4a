package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record PriceQuote(String symbol, Market market, BigDecimal price, Instant observedAt, String sourceTag) {}
