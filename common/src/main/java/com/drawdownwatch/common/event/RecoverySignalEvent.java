package com.drawdownwatch.common.event;

import com.drawdownwatch.common.market.Market;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record RecoverySignalEvent(
        @JsonProperty("alert_id") String alertId,
        String symbol,
        Market market,
        @JsonProperty("bottom_price") BigDecimal bottomPrice,
        @JsonProperty("current_price") BigDecimal currentPrice,
        @JsonProperty("recovery_percentage") BigDecimal recoveryPercentage,
        @JsonProperty("signalled_at") Instant signalledAt) {}
