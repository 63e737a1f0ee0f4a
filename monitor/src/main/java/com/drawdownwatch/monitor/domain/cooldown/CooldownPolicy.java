package com.drawdownwatch.monitor.domain.cooldown;

import java.math.BigDecimal;
import java.time.Duration;

public record CooldownPolicy(BigDecimal furtherDropPercent, Duration trackingTtl) {

    public static CooldownPolicy defaults() {
        return new CooldownPolicy(BigDecimal.valueOf(5), Duration.ofDays(7));
    }
}
