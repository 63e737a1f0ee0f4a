package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.id.UlidGenerator;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.alert.AlertNotifier;
import com.drawdownwatch.monitor.domain.alert.AlertRecordStore;
import com.drawdownwatch.monitor.domain.cooldown.CooldownEngine;
import com.drawdownwatch.monitor.domain.price.BaselineReadService;
import com.drawdownwatch.monitor.domain.price.MarketDate;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.domain.price.PriceReadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One detection pass over a market: reads the cached snapshot once, finds the strongest crossing
 * per symbol and turns the crossings the cooldown engine lets through into stored alerts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawdownEvaluationService {

    /** Highest rung wins; on a tie the shorter timeframe wins. */
    static final Comparator<ThresholdCrossing> STRENGTH = Comparator
            .comparingInt(ThresholdCrossing::threshold)
            .thenComparingInt(crossing -> -crossing.timeframe().lookbackDays());

    private final PriceReadService priceReadService;
    private final BaselineReadService baselineReadService;
    private final ThresholdDetector detector;
    private final DetectionPolicy detectionPolicy;
    private final CooldownEngine cooldownEngine;
    private final AlertRecordStore recordStore;
    private final AlertNotifier notifier;
    private final Clock clock;

    public EvaluationResult evaluate(Market market) {
        var snapshot = priceReadService.currentPrices(market);
        var today = MarketDate.today(market, clock);

        var emitted = new ArrayList<Alert>();
        var suppressed = 0;
        for (var quote : snapshot.values()) {
            var strongest = strongestCrossing(quote, market);
            if (strongest.isEmpty()) {
                continue;
            }
            var crossing = strongest.get();
            var decision = cooldownEngine.shouldEmit(quote.symbol(), market, quote.price(), crossing, today);
            if (!decision.emit()) {
                suppressed++;
                log.debug("Suppressed {} {}% {} crossing for {} ({})",
                        crossing.timeframe().code(), crossing.threshold(), decision.reason().code(), quote.symbol(), market);
                continue;
            }
            emit(crossing, decision.reason().code()).ifPresent(emitted::add);
        }
        if (!emitted.isEmpty() || suppressed > 0) {
            log.info("Evaluation of {} emitted {} alerts, suppressed {}", market, emitted.size(), suppressed);
        }
        return new EvaluationResult(market, List.copyOf(emitted), suppressed);
    }

    private Optional<ThresholdCrossing> strongestCrossing(PriceQuote quote, Market market) {
        try {
            var baselines = baselineReadService.baselines(quote.symbol(), market);
            return detector.detect(quote.symbol(), market, quote, baselines).stream().max(STRENGTH);
        } catch (RuntimeException e) {
            log.warn("Detection failed for {} ({}): {}", quote.symbol(), market, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Alert> emit(ThresholdCrossing crossing, String reason) {
        var alert = Alert.builder()
                .id(UlidGenerator.generate(clock))
                .symbol(crossing.symbol())
                .market(crossing.market())
                .dropPercentage(crossing.dropPercentage().setScale(2, RoundingMode.HALF_UP))
                .threshold(crossing.threshold())
                .timeframe(crossing.timeframe())
                .price(crossing.currentPrice())
                .historicalPrice(crossing.baselinePrice())
                .timestamp(clock.instant())
                .critical(detectionPolicy.isCritical(crossing.threshold()))
                .build();
        Alert stored;
        try {
            stored = recordStore.insert(alert);
        } catch (RuntimeException e) {
            log.error("Failed to store alert for {} ({})", alert.symbol(), alert.market(), e);
            return Optional.empty();
        }
        log.info("Alert {} for {} ({}): {}% below {} baseline, rung {}%{}, reason {}",
                stored.id(), stored.symbol(), stored.market(), stored.dropPercentage(), stored.timeframe().code(),
                stored.threshold(), stored.critical() ? " CRITICAL" : "", reason);
        notifier.notifyAlert(stored);
        return Optional.of(stored);
    }
}
