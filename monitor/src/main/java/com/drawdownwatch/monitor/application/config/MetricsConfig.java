package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.refresh.RefreshCycleSupervisor;
import com.drawdownwatch.monitor.domain.refresh.RefreshHealth;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter recoverySignalsCounter(MeterRegistry registry) {
        return Counter.builder("drawdown.recovery.signals")
                .description("Recovery signals sent after a bounce from the bottom")
                .register(registry);
    }

    @Bean
    public MeterBinder refreshHealthMetrics(RefreshCycleSupervisor supervisor, Clock clock) {
        return registry -> {
            for (var market : Market.values()) {
                var state = supervisor.state(market);
                Gauge.builder("drawdown.refresh.consecutive-failures", state, s -> s.consecutiveFailures())
                        .description("Consecutive failed refresh runs")
                        .tag("market", market.name())
                        .register(registry);
                Gauge.builder("drawdown.refresh.healthy", state,
                                s -> s.health(clock.instant()) == RefreshHealth.HEALTHY ? 1 : 0)
                        .description("1 when the market's refresh cycle is healthy")
                        .tag("market", market.name())
                        .register(registry);
            }
        };
    }
}
