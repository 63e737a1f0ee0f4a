package com.drawdownwatch.monitor.domain.refresh;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import com.drawdownwatch.monitor.domain.exceptions.EmptyResultSetException;
import com.drawdownwatch.monitor.domain.price.ActiveSymbolRegistry;
import com.drawdownwatch.monitor.domain.price.PriceSourceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Pulls current prices of a market from upstream and replaces the cached snapshot.
 *
 * <p>Runs never overlap per market: a trigger that arrives while a run is in flight is dropped,
 * not queued. Failures are recorded on the market's {@link RefreshCycleState} and never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshCycle {

    static final int WARN_AFTER_FAILURES = 3;

    private final ActiveSymbolRegistry symbolRegistry;
    private final PriceSourceGateway gateway;
    private final TieredPriceCache cache;
    private final BaselineRefresher baselineRefresher;
    private final RefreshCycleSupervisor supervisor;
    private final Clock clock;

    public RefreshOutcome run(Market market) {
        var state = supervisor.state(market);
        if (!state.tryStart(clock.instant())) {
            log.debug("Refresh already in progress for {}, skipping this cycle", market);
            return RefreshOutcome.SKIPPED;
        }
        try {
            log.info("Starting price refresh for {}", market);
            var symbols = symbolRegistry.listActiveSymbols(market);
            var quotes = gateway.getCurrent(symbols, market);
            if (quotes.isEmpty()) {
                throw EmptyResultSetException.of(market, symbols.size());
            }

            cache.replaceSnapshot(market, quotes);
            quotes.values().forEach(quote -> {
                cache.putLatest(quote);
                cache.appendRecent(quote);
            });
            state.recordSuccess(clock.instant(), quotes.size());
            log.info("Refresh completed for {}: {}/{} symbols", market, quotes.size(), symbols.size());

            baselineRefresher.spawn(market, quotes.keySet());
            return RefreshOutcome.SUCCEEDED;
        } catch (EmptyResultSetException e) {
            log.warn(e.getMessage());
            recordFailure(state, e);
            return RefreshOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Error during price refresh for {}", market, e);
            recordFailure(state, e);
            return RefreshOutcome.FAILED;
        } finally {
            state.finish();
        }
    }

    /** Manual trigger; subject to the same overlap guard as scheduled runs. */
    public RefreshOutcome forceRefresh(Market market) {
        log.info("Forced refresh requested for {}", market);
        return run(market);
    }

    public void resetFailures(Market market) {
        log.info("Resetting refresh failure counter for {}", market);
        supervisor.state(market).resetFailures();
    }

    public RefreshCycleStatus status(Market market) {
        return supervisor.state(market).view(clock.instant());
    }

    public boolean isHealthy(Market market) {
        return supervisor.state(market).health(clock.instant()) == RefreshHealth.HEALTHY;
    }

    private void recordFailure(RefreshCycleState state, RuntimeException e) {
        var failures = state.recordFailure(e.getMessage());
        if (failures >= WARN_AFTER_FAILURES) {
            log.warn("{} consecutive refresh failures for {}", failures, state.market());
        }
    }
}
