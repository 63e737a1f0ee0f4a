package com.drawdownwatch.monitor.application.job;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.application.config.DrawdownProperties;
import com.drawdownwatch.monitor.domain.detection.DrawdownEvaluationService;
import com.drawdownwatch.monitor.domain.detection.EvaluationResult;
import com.drawdownwatch.monitor.domain.price.MarketStatusService;
import com.drawdownwatch.monitor.domain.refresh.RefreshCycle;
import com.drawdownwatch.monitor.domain.refresh.RefreshOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    @Mock
    RefreshCycle refreshCycle;

    @Mock
    DrawdownEvaluationService evaluationService;

    @Mock
    MarketStatusService marketStatusService;

    @Mock
    DrawdownProperties properties;

    private SimpleMeterRegistry meterRegistry;
    private RefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new RefreshScheduler(
                refreshCycle, evaluationService, marketStatusService, properties, meterRegistry, Runnable::run);
    }

    @Test
    void refreshMarkets_closedMarketRespectingHours_isSkipped() {
        // given
        given(properties.enabledMarkets()).willReturn(List.of(Market.INDIA, Market.USA));
        given(properties.respectsTradingHours(any())).willReturn(true);
        given(marketStatusService.isOpen(Market.INDIA)).willReturn(true);
        given(marketStatusService.isOpen(Market.USA)).willReturn(false);
        given(refreshCycle.run(Market.INDIA)).willReturn(RefreshOutcome.FAILED);

        // when
        scheduler.refreshMarkets();

        // then
        then(refreshCycle).should().run(Market.INDIA);
        then(refreshCycle).should(never()).run(Market.USA);
    }

    @Test
    void refreshMarkets_marketIgnoringHours_refreshesWhenClosed() {
        // given
        given(properties.enabledMarkets()).willReturn(List.of(Market.USA));
        given(properties.respectsTradingHours(Market.USA)).willReturn(false);
        given(refreshCycle.run(Market.USA)).willReturn(RefreshOutcome.SKIPPED);

        // when
        scheduler.refreshMarkets();

        // then
        then(marketStatusService).shouldHaveNoInteractions();
        then(evaluationService).shouldHaveNoInteractions();
        assertThat(meterRegistry.counter("drawdown.refresh.runs", "market", "USA", "outcome", "skipped").count())
                .isEqualTo(1.0);
    }

    @Test
    void refreshMarkets_executorBusy_countsSkippedRun() {
        // given
        scheduler = new RefreshScheduler(refreshCycle, evaluationService, marketStatusService, properties, meterRegistry,
                task -> {
                    throw new RejectedExecutionException("busy");
                });
        given(properties.enabledMarkets()).willReturn(List.of(Market.INDIA));
        given(properties.respectsTradingHours(Market.INDIA)).willReturn(false);

        // when
        scheduler.refreshMarkets();

        // then
        then(refreshCycle).shouldHaveNoInteractions();
        assertThat(meterRegistry.counter("drawdown.refresh.runs", "market", "INDIA", "outcome", "skipped").count())
                .isEqualTo(1.0);
    }

    @Test
    void refreshAndEvaluate_success_evaluatesAndCountsAlerts() {
        // given
        given(refreshCycle.run(Market.INDIA)).willReturn(RefreshOutcome.SUCCEEDED);
        given(evaluationService.evaluate(Market.INDIA)).willReturn(new EvaluationResult(Market.INDIA, List.of(), 3));

        // when
        scheduler.refreshAndEvaluate(Market.INDIA);

        // then
        assertThat(meterRegistry.counter("drawdown.refresh.runs", "market", "INDIA", "outcome", "succeeded").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("drawdown.alerts.suppressed", "market", "INDIA").count()).isEqualTo(3.0);
    }

    @Test
    void refreshAndEvaluate_failedRefresh_doesNotEvaluate() {
        // given
        given(refreshCycle.run(Market.INDIA)).willReturn(RefreshOutcome.FAILED);

        // when
        scheduler.refreshAndEvaluate(Market.INDIA);

        // then
        then(evaluationService).shouldHaveNoInteractions();
    }
}
