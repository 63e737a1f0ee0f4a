package com.drawdownwatch.monitor.application.job;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.application.config.DrawdownProperties;
import com.drawdownwatch.monitor.domain.detection.DrawdownEvaluationService;
import com.drawdownwatch.monitor.domain.price.MarketStatusService;
import com.drawdownwatch.monitor.domain.refresh.RefreshCycle;
import com.drawdownwatch.monitor.domain.refresh.RefreshOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Triggers the refresh cycle of every enabled market and, after a successful refresh, the
 * drawdown evaluation of that market. Markets run side by side on the refresh executor.
 */
@Slf4j
@Component
public class RefreshScheduler {

    private final RefreshCycle refreshCycle;
    private final DrawdownEvaluationService evaluationService;
    private final MarketStatusService marketStatusService;
    private final DrawdownProperties properties;
    private final MeterRegistry meterRegistry;
    private final Executor refreshExecutor;

    public RefreshScheduler(
            RefreshCycle refreshCycle,
            DrawdownEvaluationService evaluationService,
            MarketStatusService marketStatusService,
            DrawdownProperties properties,
            MeterRegistry meterRegistry,
            @Qualifier("refreshExecutor") Executor refreshExecutor) {
        this.refreshCycle = refreshCycle;
        this.evaluationService = evaluationService;
        this.marketStatusService = marketStatusService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.refreshExecutor = refreshExecutor;
    }

    @Scheduled(fixedDelayString = "${drawdown.refresh.interval-ms}", initialDelayString = "${drawdown.refresh.interval-ms}")
    public void refreshMarkets() {
        for (var market : properties.enabledMarkets()) {
            if (properties.respectsTradingHours(market) && !marketStatusService.isOpen(market)) {
                log.debug("{} is closed, skipping refresh", market);
                continue;
            }
            try {
                refreshExecutor.execute(() -> refreshAndEvaluate(market));
            } catch (RejectedExecutionException e) {
                log.debug("Refresh of {} still in flight, trigger dropped", market);
                countRun(market, RefreshOutcome.SKIPPED);
            }
        }
    }

    void refreshAndEvaluate(Market market) {
        var outcome = refreshCycle.run(market);
        countRun(market, outcome);
        if (outcome != RefreshOutcome.SUCCEEDED) {
            return;
        }
        try {
            var result = evaluationService.evaluate(market);
            meterRegistry.counter("drawdown.alerts.emitted", "market", market.name()).increment(result.emitted().size());
            meterRegistry.counter("drawdown.alerts.suppressed", "market", market.name()).increment(result.suppressed());
        } catch (RuntimeException e) {
            log.error("Drawdown evaluation failed for {}", market, e);
        }
    }

    private void countRun(Market market, RefreshOutcome outcome) {
        meterRegistry.counter("drawdown.refresh.runs",
                "market", market.name(),
                "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }
}
