package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.common.market.Market;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "drawdown")
public record DrawdownProperties(
        @NotEmpty Map<Market, @Valid MarketSettings> markets,
        @NotNull @Valid Refresh refresh,
        @NotNull @Valid Detection detection,
        @NotNull @Valid Cooldown cooldown,
        @NotNull @Valid Recovery recovery,
        @NotNull @Valid Cache cache,
        @NotNull @Valid Gateway gateway) {

    public List<Market> enabledMarkets() {
        return markets.entrySet().stream()
                .filter(entry -> entry.getValue().enabled())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public boolean respectsTradingHours(Market market) {
        var settings = markets.get(market);
        return settings != null && settings.respectTradingHours();
    }

    public record MarketSettings(boolean enabled, boolean respectTradingHours) {}

    public record Refresh(@Min(1000) long intervalMs) {}

    public record Detection(@NotEmpty List<@Min(1) Integer> rungs, @Min(1) int criticalThreshold) {}

    public record Cooldown(@NotNull @DecimalMin("0.0") BigDecimal furtherDropPercent, @NotNull Duration trackingTtl) {}

    public record Recovery(
            @NotNull @DecimalMin("0.0") BigDecimal bouncePercent,
            @Min(1) int sweepLimit,
            @Min(1000) long sweepIntervalMs) {}

    public record Cache(@NotNull StoreType store, @NotNull @Valid Ttl ttl, @Min(1) int recentSeriesSize) {

        public enum StoreType {
            REDIS,
            MEMORY
        }

        public record Ttl(
                @NotNull Duration currentSnapshot,
                @NotNull Duration latest,
                @NotNull Duration historyDay,
                @NotNull Duration historyWeek,
                @NotNull Duration historyLongTerm,
                @NotNull Duration recentSeries,
                @NotNull Duration marketStatus) {}
    }

    public record Gateway(
            @NotNull Duration fetchTimeout,
            @NotNull Duration batchDeadline,
            @NotNull Duration connectTimeout,
            @Min(1) int threads,
            @Min(1) int baselineThreads,
            @NotBlank String yahooBaseUrl,
            @NotBlank String mutualFundBaseUrl,
            @NotBlank String nseBaseUrl,
            @NotBlank String userAgent) {}
}
