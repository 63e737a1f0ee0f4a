package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record ThresholdCrossing(
        String symbol,
        Market market,
        Timeframe timeframe,
        int threshold,
        BigDecimal dropPercentage,
        BigDecimal currentPrice,
        BigDecimal baselinePrice) {}
