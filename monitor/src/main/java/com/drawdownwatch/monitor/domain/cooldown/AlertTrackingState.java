package com.drawdownwatch.monitor.domain.cooldown;

import com.drawdownwatch.common.market.Timeframe;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Last emitted alert of a symbol. {@code lastAlertDate} is a market-local calendar date.
 */
public record AlertTrackingState(
        BigDecimal lastAlertPrice,
        LocalDate lastAlertDate,
        int highestThresholdFired,
        Timeframe timeframe) {}
