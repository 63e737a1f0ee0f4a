package com.drawdownwatch.monitor.domain.recovery;

import java.math.BigDecimal;

public record RecoveryPolicy(BigDecimal bouncePercent, int sweepLimit) {

    public static RecoveryPolicy defaults() {
        return new RecoveryPolicy(BigDecimal.valueOf(2), 100);
    }
}
