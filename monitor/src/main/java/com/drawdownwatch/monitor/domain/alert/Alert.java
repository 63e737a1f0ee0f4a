package com.drawdownwatch.monitor.domain.alert;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record Alert(
        String id,
        String symbol,
        Market market,
        BigDecimal dropPercentage,
        int threshold,
        Timeframe timeframe,
        BigDecimal price,
        BigDecimal historicalPrice,
        Instant timestamp,
        boolean critical) {}
