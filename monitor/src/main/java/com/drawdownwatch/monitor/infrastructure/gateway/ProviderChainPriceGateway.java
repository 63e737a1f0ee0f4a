package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.exceptions.UpstreamUnavailableException;
import com.drawdownwatch.monitor.domain.price.HistoricalBaseline;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.domain.price.PriceSourceGateway;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Price gateway over an ordered list of providers. Each symbol is tried against the providers
 * that support it, in order, until one answers.
 *
 * <p>Current prices are fetched concurrently. Every symbol fetch is bounded by the fetch timeout
 * and the whole batch by the batch deadline; symbols still running at the deadline are cancelled
 * and left out of the result.
 */
@Slf4j
public class ProviderChainPriceGateway implements PriceSourceGateway {

    /** Daily closes requested for baselines: one year plus the tolerance window. */
    static final int HISTORY_DAYS = Timeframe.ONE_YEAR.lookbackDays() + 14;

    private final List<PriceProvider> providers;
    private final Executor executor;
    private final Duration fetchTimeout;
    private final Duration batchDeadline;
    private final Clock clock;
    private final BaselineExtractor baselineExtractor = new BaselineExtractor();

    public ProviderChainPriceGateway(
            List<PriceProvider> providers,
            Executor executor,
            Duration fetchTimeout,
            Duration batchDeadline,
            Clock clock) {
        this.providers = List.copyOf(providers);
        this.executor = executor;
        this.fetchTimeout = fetchTimeout;
        this.batchDeadline = batchDeadline;
        this.clock = clock;
    }

    @Override
    public Map<String, PriceQuote> getCurrent(Collection<String> symbols, Market market) {
        var failures = new AtomicInteger();
        var fetches = new LinkedHashMap<String, CompletableFuture<Optional<PriceQuote>>>();
        for (var symbol : symbols) {
            fetches.put(symbol, CompletableFuture.supplyAsync(() -> fetchCurrent(symbol, market), executor)
                    .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        failures.incrementAndGet();
                        log.warn("Price fetch for {} ({}) failed: {}", symbol, market, rootMessage(ex));
                        return Optional.empty();
                    }));
        }

        awaitBatch(market, fetches.values());

        var quotes = new LinkedHashMap<String, PriceQuote>();
        var abandoned = 0;
        for (var fetch : fetches.entrySet()) {
            var future = fetch.getValue();
            if (!future.isDone()) {
                future.cancel(true);
                abandoned++;
                continue;
            }
            future.join().ifPresent(quote -> quotes.put(fetch.getKey(), quote));
        }
        if (failures.get() > 0 || abandoned > 0) {
            log.warn("Fetched {}/{} prices for {} ({} failed, {} abandoned at deadline)",
                    quotes.size(), symbols.size(), market, failures.get(), abandoned);
        }
        return quotes;
    }

    @Override
    public Map<Timeframe, HistoricalBaseline> getHistorical(String symbol, Market market) {
        var today = market.localDate(clock.instant());
        var from = today.minusDays(HISTORY_DAYS);
        UpstreamUnavailableException lastFailure = null;
        for (var provider : providers) {
            if (!provider.supports(symbol, market)) {
                continue;
            }
            try {
                var closes = provider.fetchDailyCloses(symbol, market, from, today);
                if (!closes.isEmpty()) {
                    return baselineExtractor.extract(symbol, market, closes, today);
                }
                log.debug("{} has no daily closes for {} ({})", provider.providerName(), symbol, market);
            } catch (UpstreamUnavailableException e) {
                log.warn("{} history failed for {} ({}): {}", provider.providerName(), symbol, market, e.getMessage());
                lastFailure = e;
            }
        }
        if (lastFailure != null) {
            throw lastFailure;
        }
        throw UpstreamUnavailableException.emptyResponse("every provider", symbol, market);
    }

    private Optional<PriceQuote> fetchCurrent(String symbol, Market market) {
        for (var provider : providers) {
            if (!provider.supports(symbol, market)) {
                continue;
            }
            try {
                var quote = provider.fetchCurrent(symbol, market);
                if (quote.isPresent()) {
                    return quote;
                }
                log.debug("{} has no price for {} ({})", provider.providerName(), symbol, market);
            } catch (UpstreamUnavailableException e) {
                log.warn("{} failed for {} ({}): {}", provider.providerName(), symbol, market, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private void awaitBatch(Market market, Collection<CompletableFuture<Optional<PriceQuote>>> fetches) {
        try {
            CompletableFuture.allOf(fetches.toArray(CompletableFuture[]::new))
                    .get(batchDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Batch deadline of {} reached for {}", batchDeadline, market);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching prices for {}", market);
        } catch (ExecutionException e) {
            log.error("Unexpected failure in price batch for {}", market, e.getCause());
        }
    }

    private static String rootMessage(Throwable ex) {
        var cause = ex;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof TimeoutException ? "timed out" : String.valueOf(cause.getMessage());
    }
}
