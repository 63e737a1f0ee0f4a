package com.drawdownwatch.monitor.infrastructure.tracking;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.cache.CacheStore;
import com.drawdownwatch.monitor.domain.cooldown.AlertTrackingState;
import com.drawdownwatch.monitor.domain.cooldown.CooldownPolicy;
import com.drawdownwatch.monitor.domain.exceptions.CacheUnavailableException;
import com.drawdownwatch.monitor.domain.exceptions.TrackingStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class CacheAlertTrackingStoreTest {

    @Mock
    CacheStore cacheStore;

    private CacheAlertTrackingStore trackingStore;

    @BeforeEach
    void setUp() {
        trackingStore = new CacheAlertTrackingStore(cacheStore, CooldownPolicy.defaults());
    }

    @Test
    void save_writesJsonUnderTrackingKeyWithPolicyTtl() {
        // given
        var state = new AlertTrackingState(new BigDecimal("180"), LocalDate.of(2026, 3, 2), 10, Timeframe.ONE_DAY);
        var json = ArgumentCaptor.forClass(String.class);

        // when
        trackingStore.save(Market.INDIA, "X", state);

        // then
        then(cacheStore).should().set(eq("alert-tracking:INDIA:X"), json.capture(), eq(Duration.ofDays(7)));
        assertThat(json.getValue()).contains("\"2026-03-02\"").contains("\"1d\"");
    }

    @Test
    void find_storedJson_isDecoded() {
        // given
        given(cacheStore.get("alert-tracking:USA:AAPL")).willReturn(Optional.of(
                "{\"lastAlertPrice\":150.25,\"lastAlertDate\":\"2026-03-02\",\"highestThresholdFired\":15,\"timeframe\":\"1w\"}"));

        // when
        var state = trackingStore.find(Market.USA, "AAPL");

        // then
        assertThat(state).hasValueSatisfying(found -> {
            assertThat(found.lastAlertPrice()).isEqualByComparingTo("150.25");
            assertThat(found.highestThresholdFired()).isEqualTo(15);
            assertThat(found.timeframe()).isEqualTo(Timeframe.ONE_WEEK);
        });
    }

    @Test
    void find_unreadableJson_isTreatedAsNoState() {
        // given
        given(cacheStore.get("alert-tracking:USA:AAPL")).willReturn(Optional.of("garbage"));

        // when / then
        assertThat(trackingStore.find(Market.USA, "AAPL")).isEmpty();
    }

    @Test
    void find_cacheUnavailable_throwsTrackingStoreUnavailable() {
        // given
        given(cacheStore.get("alert-tracking:USA:AAPL"))
                .willThrow(CacheUnavailableException.of("get", "alert-tracking:USA:AAPL", new IllegalStateException("down")));

        // when / then
        assertThatThrownBy(() -> trackingStore.find(Market.USA, "AAPL"))
                .isInstanceOf(TrackingStoreUnavailableException.class);
    }
}
