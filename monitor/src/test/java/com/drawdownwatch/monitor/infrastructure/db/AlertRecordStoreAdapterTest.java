package com.drawdownwatch.monitor.infrastructure.db;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;
import com.drawdownwatch.monitor.infrastructure.db.alert.AlertEntity;
import com.drawdownwatch.monitor.infrastructure.db.alert.AlertJpaRepository;
import com.drawdownwatch.monitor.infrastructure.db.alert.mapper.AlertEntityMapper;
import com.drawdownwatch.monitor.infrastructure.db.recovery.RecoveryTrackingEntity;
import com.drawdownwatch.monitor.infrastructure.db.recovery.RecoveryTrackingJpaRepository;
import com.drawdownwatch.monitor.infrastructure.db.recovery.mapper.RecoveryTrackingEntityMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class AlertRecordStoreAdapterTest {

    private static final Instant TRIGGERED_AT = Instant.parse("2026-03-02T05:00:00Z");

    @Mock
    AlertJpaRepository alertJpaRepository;

    @Mock
    RecoveryTrackingJpaRepository recoveryTrackingJpaRepository;

    private AlertRecordStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new AlertRecordStoreAdapter(
                alertJpaRepository,
                recoveryTrackingJpaRepository,
                Mappers.getMapper(AlertEntityMapper.class),
                Mappers.getMapper(RecoveryTrackingEntityMapper.class));
    }

    @Test
    void shouldMapEveryAlertFieldOnInsert() {
        // given
        var alert = buildAlert();
        given(alertJpaRepository.save(any(AlertEntity.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        var stored = adapter.insert(alert);

        // then
        assertThat(stored)
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(alert);
        var captor = ArgumentCaptor.forClass(AlertEntity.class);
        then(alertJpaRepository).should().save(captor.capture());
        assertThat(captor.getValue().getTimeframe()).isEqualTo(Timeframe.ONE_DAY);
        assertThat(captor.getValue().getTimestamp()).isEqualTo(TRIGGERED_AT);
    }

    @Test
    void shouldRequestNewestAlertsOfMarketWithLimit() {
        // given
        var entity = Mappers.getMapper(AlertEntityMapper.class).toEntity(buildAlert());
        given(alertJpaRepository.findByMarketOrderByTimestampDesc(Market.INDIA, PageRequest.of(0, 25)))
                .willReturn(List.of(entity));

        // when
        var alerts = adapter.findRecent(Market.INDIA, 25);

        // then
        assertThat(alerts).extracting(Alert::id).containsExactly("01JNQ0000000000000000000AA");
    }

    @Test
    void shouldReturnEmptyWhenAlertHasNoTrackingRow() {
        // given
        given(recoveryTrackingJpaRepository.findById("missing")).willReturn(Optional.empty());

        // when / then
        assertThat(adapter.findTrackingState("missing")).isEmpty();
    }

    @Test
    void shouldUpsertTrackingStateByAlertId() {
        // given
        var state = RecoveryTrackingState.builder()
                .alertId("01JNQ0000000000000000000AA")
                .symbol("X")
                .market(Market.INDIA)
                .bottomPrice(new BigDecimal("170.9"))
                .currentPrice(new BigDecimal("174.32"))
                .recoveryPercentage(new BigDecimal("2.00"))
                .notified(true)
                .build();
        given(recoveryTrackingJpaRepository.save(any(RecoveryTrackingEntity.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        var saved = adapter.upsertTrackingState(state);

        // then
        assertThat(saved).isEqualTo(state);
        var captor = ArgumentCaptor.forClass(RecoveryTrackingEntity.class);
        then(recoveryTrackingJpaRepository).should().save(captor.capture());
        assertThat(captor.getValue().getAlertId()).isEqualTo("01JNQ0000000000000000000AA");
        assertThat(captor.getValue().isNotified()).isTrue();
    }

    private static Alert buildAlert() {
        return Alert.builder()
                .id("01JNQ0000000000000000000AA")
                .symbol("X")
                .market(Market.INDIA)
                .dropPercentage(new BigDecimal("10.00"))
                .threshold(10)
                .timeframe(Timeframe.ONE_DAY)
                .price(new BigDecimal("180"))
                .historicalPrice(new BigDecimal("200"))
                .timestamp(TRIGGERED_AT)
                .critical(false)
                .build();
    }
}
