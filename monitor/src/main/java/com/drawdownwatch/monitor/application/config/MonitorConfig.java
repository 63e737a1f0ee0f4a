package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.monitor.domain.cache.CacheTtlPolicy;
import com.drawdownwatch.monitor.domain.cooldown.CooldownPolicy;
import com.drawdownwatch.monitor.domain.detection.DetectionPolicy;
import com.drawdownwatch.monitor.domain.recovery.RecoveryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DrawdownProperties.class)
public class MonitorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(DrawdownProperties properties) {
        var cache = properties.cache();
        var ttl = cache.ttl();
        return new CacheTtlPolicy(
                ttl.currentSnapshot(),
                ttl.latest(),
                ttl.historyDay(),
                ttl.historyWeek(),
                ttl.historyLongTerm(),
                ttl.recentSeries(),
                ttl.marketStatus(),
                cache.recentSeriesSize());
    }

    @Bean
    public DetectionPolicy detectionPolicy(DrawdownProperties properties) {
        var detection = properties.detection();
        return new DetectionPolicy(detection.rungs(), detection.criticalThreshold());
    }

    @Bean
    public CooldownPolicy cooldownPolicy(DrawdownProperties properties) {
        var cooldown = properties.cooldown();
        return new CooldownPolicy(cooldown.furtherDropPercent(), cooldown.trackingTtl());
    }

    @Bean
    public RecoveryPolicy recoveryPolicy(DrawdownProperties properties) {
        var recovery = properties.recovery();
        return new RecoveryPolicy(recovery.bouncePercent(), recovery.sweepLimit());
    }
}
