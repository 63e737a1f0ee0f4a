package com.drawdownwatch.monitor.domain.recovery;

import com.drawdownwatch.common.market.Market;
import lombok.Builder;

import java.math.BigDecimal;

@Builder(toBuilder = true)
public record RecoveryTrackingState(
        String alertId,
        String symbol,
        Market market,
        BigDecimal bottomPrice,
        BigDecimal currentPrice,
        BigDecimal recoveryPercentage,
        boolean notified) {

    public RecoveryStatus status() {
        return notified ? RecoveryStatus.RECOVERED : RecoveryStatus.TRACKING;
    }
}
