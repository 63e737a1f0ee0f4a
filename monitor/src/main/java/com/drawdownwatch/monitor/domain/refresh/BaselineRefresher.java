package com.drawdownwatch.monitor.domain.refresh;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import com.drawdownwatch.monitor.domain.price.HistoricalBaseline;
import com.drawdownwatch.monitor.domain.price.PriceSourceGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Recomputes historical baselines after a snapshot write. Runs on its own executor and is never
 * awaited by the refresh cycle; a failing symbol is logged and the batch moves on. At most one
 * recomputation per market is in flight; a trigger arriving meanwhile is dropped, not queued.
 */
@Slf4j
@Component
public class BaselineRefresher {

    private final PriceSourceGateway gateway;
    private final TieredPriceCache cache;
    private final Executor executor;
    private final Set<Market> inFlight = ConcurrentHashMap.newKeySet();

    public BaselineRefresher(
            PriceSourceGateway gateway,
            TieredPriceCache cache,
            @Qualifier("baselineExecutor") Executor executor) {
        this.gateway = gateway;
        this.cache = cache;
        this.executor = executor;
    }

    /**
     * Completes with the number of symbols whose baselines were cached, or with zero right away when
     * a recomputation for the market is still running.
     */
    public CompletableFuture<Integer> spawn(Market market, Collection<String> symbols) {
        if (!inFlight.add(market)) {
            log.debug("Baseline refresh for {} still running, trigger dropped", market);
            return CompletableFuture.completedFuture(0);
        }
        var batch = List.copyOf(symbols);
        CompletableFuture<Integer> task;
        try {
            task = CompletableFuture.supplyAsync(() -> refresh(market, batch), executor);
        } catch (RejectedExecutionException e) {
            inFlight.remove(market);
            log.warn("Baseline refresh for {} rejected: {}", market, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return task.whenComplete((cached, ex) -> {
                    inFlight.remove(market);
                    if (ex != null) {
                        log.error("Baseline refresh for {} aborted", market, ex);
                    } else {
                        log.debug("Baseline refresh for {} cached {}/{} symbols", market, cached, batch.size());
                    }
                });
    }

    private int refresh(Market market, List<String> symbols) {
        var cached = 0;
        for (var symbol : symbols) {
            try {
                var baselines = HistoricalBaseline.allTimeframes(symbol, market, gateway.getHistorical(symbol, market));
                baselines.values().forEach(cache::putBaseline);
                cached++;
            } catch (RuntimeException e) {
                log.warn("Baseline refresh failed for {} ({}): {}", symbol, market, e.getMessage());
            }
        }
        return cached;
    }
}
