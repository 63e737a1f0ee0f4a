package com.drawdownwatch.monitor.domain.refresh;

import com.drawdownwatch.common.market.Market;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping of one market's refresh cycle. At most one run holds the {@code running}
 * flag at a time; everything else is written only by that run.
 */
public class RefreshCycleState {

    private final Market market;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Instant lastStart;
    private volatile Instant lastComplete;
    private volatile Duration lastDuration = Duration.ZERO;
    private volatile int lastSymbolCount;
    private volatile int consecutiveFailures;
    private volatile String lastError;

    public RefreshCycleState(Market market) {
        this.market = market;
    }

    public Market market() {
        return market;
    }

    /** Claims the cycle. Returns false, leaving the state untouched, when a run is in flight. */
    public boolean tryStart(Instant now) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        lastStart = now;
        lastError = null;
        return true;
    }

    public void recordSuccess(Instant completedAt, int symbolCount) {
        lastComplete = completedAt;
        lastDuration = Duration.between(lastStart, completedAt);
        lastSymbolCount = symbolCount;
        consecutiveFailures = 0;
    }

    /** Returns the failure count including this one. */
    public int recordFailure(String error) {
        lastError = error;
        return ++consecutiveFailures;
    }

    public void finish() {
        running.set(false);
    }

    public void resetFailures() {
        consecutiveFailures = 0;
        lastError = null;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public RefreshHealth health(Instant now) {
        return RefreshHealth.of(consecutiveFailures, lastComplete, now);
    }

    public RefreshCycleStatus view(Instant now) {
        return new RefreshCycleStatus(
                market,
                running.get(),
                lastStart,
                lastComplete,
                lastDuration,
                lastSymbolCount,
                consecutiveFailures,
                lastError,
                health(now));
    }
}
