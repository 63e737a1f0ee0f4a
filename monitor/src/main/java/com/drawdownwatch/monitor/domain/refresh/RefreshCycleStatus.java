package com.drawdownwatch.monitor.domain.refresh;

import com.drawdownwatch.common.market.Market;

import java.time.Duration;
import java.time.Instant;

public record RefreshCycleStatus(
        Market market,
        boolean running,
        Instant lastStart,
        Instant lastComplete,
        Duration lastDuration,
        int lastSymbolCount,
        int consecutiveFailures,
        String lastError,
        RefreshHealth health) {}
