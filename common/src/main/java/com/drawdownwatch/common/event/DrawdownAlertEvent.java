package com.drawdownwatch.common.event;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record DrawdownAlertEvent(
        @JsonProperty("alert_id") String alertId,
        String symbol,
        Market market,
        Timeframe timeframe,
        int threshold,
        @JsonProperty("drop_percentage") BigDecimal dropPercentage,
        BigDecimal price,
        @JsonProperty("historical_price") BigDecimal historicalPrice,
        boolean critical,
        Instant timestamp) {}
