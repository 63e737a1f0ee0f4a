package com.drawdownwatch.monitor.domain.cache;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.drawdownwatch.monitor.support.PriceFixtures.quote;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
class TieredPriceCacheFailureTest {

    @Mock
    CacheStore store;

    private TieredPriceCache cache;

    @BeforeEach
    void setUp() {
        cache = new TieredPriceCache(store, CacheTtlPolicy.defaults());
    }

    @Test
    void read_storeUnavailable_degradesToMiss() {
        // given
        given(store.get(anyString())).willThrow(unavailable());

        // when / then
        assertThat(cache.snapshot(Market.USA)).isEmpty();
        assertThat(cache.latest(Market.USA, "AAPL")).isEmpty();
        assertThat(cache.baselines(Market.USA, "AAPL")).isEmpty();
    }

    @Test
    void write_storeUnavailable_isDropped() {
        // given
        willThrow(unavailable()).given(store).set(anyString(), anyString(), any());

        // when / then
        assertThatCode(() -> cache.replaceSnapshot(Market.USA, Map.of("AAPL", quote("AAPL", Market.USA, "180"))))
                .doesNotThrowAnyException();
    }

    @Test
    void read_unreadableValue_isTreatedAsMiss() {
        // given
        given(store.get(CacheKeys.latest(Market.USA, "AAPL"))).willReturn(java.util.Optional.of("not-json"));

        // when / then
        assertThat(cache.latest(Market.USA, "AAPL")).isEmpty();
    }

    @Test
    void stats_storeUnavailable_reportsDisconnected() {
        // given
        given(store.isAvailable()).willReturn(false);

        // when
        var stats = cache.stats(Market.USA);

        // then
        assertThat(stats.connected()).isFalse();
        assertThat(stats.keyCount()).isZero();
    }

    private static CacheUnavailableException unavailable() {
        return CacheUnavailableException.of("test", "key", new IllegalStateException("connection refused"));
    }
}
