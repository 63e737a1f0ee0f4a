package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.cache.CacheTtlPolicy;
import com.drawdownwatch.monitor.domain.cache.TieredPriceCache;
import com.drawdownwatch.monitor.domain.cooldown.CooldownEngine;
import com.drawdownwatch.monitor.domain.cooldown.CooldownPolicy;
import com.drawdownwatch.monitor.domain.price.BaselineReadService;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.domain.price.PriceReadService;
import com.drawdownwatch.monitor.domain.price.PriceSourceGateway;
import com.drawdownwatch.monitor.infrastructure.memory.InMemoryCacheStore;
import com.drawdownwatch.monitor.infrastructure.tracking.CacheAlertTrackingStore;
import com.drawdownwatch.monitor.support.InMemoryAlertRecordStore;
import com.drawdownwatch.monitor.support.MutableClock;
import com.drawdownwatch.monitor.support.RecordingAlertNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.drawdownwatch.monitor.support.PriceFixtures.MONDAY_MORNING_INDIA;
import static com.drawdownwatch.monitor.support.PriceFixtures.baselines;
import static com.drawdownwatch.monitor.support.PriceFixtures.quote;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class DrawdownEvaluationServiceTest {

    @Mock
    PriceSourceGateway gateway;

    private TieredPriceCache cache;
    private InMemoryAlertRecordStore recordStore;
    private RecordingAlertNotifier notifier;
    private DrawdownEvaluationService service;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(MONDAY_MORNING_INDIA);
        var store = new InMemoryCacheStore(clock);
        cache = new TieredPriceCache(store, CacheTtlPolicy.defaults());
        recordStore = new InMemoryAlertRecordStore();
        notifier = new RecordingAlertNotifier();
        var cooldownEngine = new CooldownEngine(
                new CacheAlertTrackingStore(store, CooldownPolicy.defaults()), CooldownPolicy.defaults(), clock);
        service = new DrawdownEvaluationService(
                new PriceReadService(cache, gateway),
                new BaselineReadService(cache, gateway),
                new ThresholdDetector(DetectionPolicy.defaults()),
                DetectionPolicy.defaults(),
                cooldownEngine,
                recordStore,
                notifier,
                clock);
    }

    @Test
    void evaluate_emptySnapshot_emitsNothing() {
        var result = service.evaluate(Market.INDIA);

        assertThat(result.emitted()).isEmpty();
        assertThat(result.suppressed()).isZero();
    }

    @Test
    void evaluate_tenPercentDrop_storesAndPublishesAlert() {
        // given
        snapshot(quote("X", Market.INDIA, "180"));
        cacheBaselines("X", Map.of(Timeframe.ONE_DAY, "200"));

        // when
        var result = service.evaluate(Market.INDIA);

        // then
        assertThat(result.emitted()).singleElement().satisfies(alert -> {
            assertThat(alert.id()).hasSize(26);
            assertThat(alert.symbol()).isEqualTo("X");
            assertThat(alert.threshold()).isEqualTo(10);
            assertThat(alert.timeframe()).isEqualTo(Timeframe.ONE_DAY);
            assertThat(alert.dropPercentage()).isEqualByComparingTo("10.00");
            assertThat(alert.price()).isEqualByComparingTo("180");
            assertThat(alert.historicalPrice()).isEqualByComparingTo("200");
            assertThat(alert.timestamp()).isEqualTo(MONDAY_MORNING_INDIA);
            assertThat(alert.critical()).isFalse();
        });
        assertThat(recordStore.alerts()).hasSize(1);
        assertThat(notifier.alerts()).hasSize(1);
    }

    @Test
    void evaluate_severalTimeframesCrossed_emitsOnlyStrongest() {
        // given
        snapshot(quote("X", Market.INDIA, "180"));
        cacheBaselines("X", Map.of(
                Timeframe.ONE_DAY, "200",
                Timeframe.ONE_MONTH, "240"));

        // when
        var result = service.evaluate(Market.INDIA);

        // then
        assertThat(result.emitted()).singleElement().satisfies(alert -> {
            assertThat(alert.timeframe()).isEqualTo(Timeframe.ONE_MONTH);
            assertThat(alert.threshold()).isEqualTo(20);
            assertThat(alert.critical()).isTrue();
        });
    }

    @Test
    void evaluate_sameRungOnTwoTimeframes_prefersShorterTimeframe() {
        // given
        snapshot(quote("X", Market.INDIA, "180"));
        cacheBaselines("X", Map.of(
                Timeframe.ONE_DAY, "200",
                Timeframe.ONE_WEEK, "205"));

        // when
        var result = service.evaluate(Market.INDIA);

        // then
        assertThat(result.emitted()).singleElement()
                .satisfies(alert -> assertThat(alert.timeframe()).isEqualTo(Timeframe.ONE_DAY));
    }

    @Test
    void evaluate_secondPassSamePrice_isSuppressedByCooldown() {
        // given
        snapshot(quote("X", Market.INDIA, "180"));
        cacheBaselines("X", Map.of(Timeframe.ONE_DAY, "200"));
        service.evaluate(Market.INDIA);

        // when
        var result = service.evaluate(Market.INDIA);

        // then
        assertThat(result.emitted()).isEmpty();
        assertThat(result.suppressed()).isEqualTo(1);
        assertThat(notifier.alerts()).hasSize(1);
    }

    @Test
    void evaluate_baselineLookupFails_skipsOnlyThatSymbol() {
        // given
        snapshot(quote("X", Market.INDIA, "180"), quote("Y", Market.INDIA, "50"));
        cacheBaselines("X", Map.of(Timeframe.ONE_DAY, "200"));
        given(gateway.getHistorical("Y", Market.INDIA)).willThrow(new IllegalStateException("upstream down"));

        // when
        var result = service.evaluate(Market.INDIA);

        // then
        assertThat(result.emitted()).extracting(alert -> alert.symbol()).containsExactly("X");
    }

    private void snapshot(PriceQuote... quotes) {
        var bySymbol = new LinkedHashMap<String, PriceQuote>();
        for (var quote : quotes) {
            bySymbol.put(quote.symbol(), quote);
        }
        cache.replaceSnapshot(Market.INDIA, bySymbol);
    }

    private void cacheBaselines(String symbol, Map<Timeframe, String> prices) {
        baselines(symbol, Market.INDIA, prices).values().forEach(cache::putBaseline);
    }
}
