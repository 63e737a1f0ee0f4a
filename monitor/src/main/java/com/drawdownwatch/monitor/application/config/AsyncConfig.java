package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.common.market.Market;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors of the refresh pipeline. Upstream fetches, baseline recomputation and per-market
 * refresh runs each get their own pool so a slow upstream cannot starve the others.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public ThreadPoolTaskExecutor gatewayExecutor(DrawdownProperties properties) {
        var threads = properties.gateway().threads();
        return executor("gateway-", threads, threads, 1_000, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /** Rejects when full; the refresher logs the rejection and the next cycle tries again. */
    @Bean
    public ThreadPoolTaskExecutor baselineExecutor(DrawdownProperties properties) {
        var threads = properties.gateway().baselineThreads();
        return executor("baseline-", threads, threads, 16, new ThreadPoolExecutor.AbortPolicy());
    }

    /** One slot per market; a run that cannot be placed is rejected, never queued behind another. */
    @Bean
    public ThreadPoolTaskExecutor refreshExecutor() {
        var markets = Market.values().length;
        return executor("refresh-", markets, markets, 0, new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor executor(
            String prefix, int core, int max, int queueCapacity, RejectedExecutionHandler rejection) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejection);
        return executor;
    }
}
