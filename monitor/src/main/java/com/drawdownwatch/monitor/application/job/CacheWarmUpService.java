package com.drawdownwatch.monitor.application.job;

import com.drawdownwatch.monitor.application.config.DrawdownProperties;
import com.drawdownwatch.monitor.domain.refresh.RefreshCycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fills the price cache once at start-up, trading hours or not, so reads are served from cache
 * before the first scheduled refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheWarmUpService {

    private final RefreshCycle refreshCycle;
    private final DrawdownProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        log.info("Starting cache warm-up for {}", properties.enabledMarkets());
        for (var market : properties.enabledMarkets()) {
            var outcome = refreshCycle.run(market);
            var status = refreshCycle.status(market);
            log.info("Cache warm-up for {}: {} ({} symbols, health {})",
                    market, outcome, status.lastSymbolCount(), status.health());
        }
    }
}
