package com.drawdownwatch.monitor.domain.refresh;

import java.time.Duration;
import java.time.Instant;

public enum RefreshHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    static final int UNHEALTHY_FAILURES = 5;
    static final int DEGRADED_FAILURES = 2;
    static final Duration STALE_AFTER = Duration.ofMinutes(10);

    /** A cycle that never completed is only judged by its failure count. */
    public static RefreshHealth of(int consecutiveFailures, Instant lastComplete, Instant now) {
        if (consecutiveFailures >= UNHEALTHY_FAILURES) {
            return UNHEALTHY;
        }
        if (consecutiveFailures >= DEGRADED_FAILURES) {
            return DEGRADED;
        }
        if (lastComplete != null && Duration.between(lastComplete, now).compareTo(STALE_AFTER) > 0) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
