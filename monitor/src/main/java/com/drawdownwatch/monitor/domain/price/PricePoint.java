package com.drawdownwatch.monitor.domain.price;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePoint(BigDecimal price, Instant observedAt) {

    public static PricePoint from(PriceQuote quote) {
        return new PricePoint(quote.price(), quote.observedAt());
    }
}
