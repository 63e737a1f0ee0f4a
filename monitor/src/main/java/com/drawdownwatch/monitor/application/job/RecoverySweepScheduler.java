package com.drawdownwatch.monitor.application.job;

import com.drawdownwatch.monitor.application.config.DrawdownProperties;
import com.drawdownwatch.monitor.domain.price.MarketStatusService;
import com.drawdownwatch.monitor.domain.recovery.RecoverySweepService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Checks recent alerts of every open market for a bounce off the bottom.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoverySweepScheduler {

    private final RecoverySweepService sweepService;
    private final MarketStatusService marketStatusService;
    private final DrawdownProperties properties;

    @Scheduled(fixedDelayString = "${drawdown.recovery.sweep-interval-ms}",
            initialDelayString = "${drawdown.recovery.sweep-interval-ms}")
    public void sweepMarkets() {
        for (var market : properties.enabledMarkets()) {
            if (!marketStatusService.isOpen(market)) {
                continue;
            }
            try {
                var observed = sweepService.sweep(market);
                log.info("Recovery sweep for {} observed {} alerts", market, observed);
            } catch (RuntimeException e) {
                log.error("Recovery sweep failed for {}", market, e);
            }
        }
    }
}
