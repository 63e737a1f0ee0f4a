package com.drawdownwatch.monitor.domain.cooldown;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.cache.CacheKeys;
import com.drawdownwatch.monitor.domain.detection.ThresholdCrossing;
import com.drawdownwatch.monitor.domain.exceptions.TrackingStoreUnavailableException;
import com.drawdownwatch.monitor.domain.price.MarketDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether a threshold crossing becomes an alert or is a repeat of one already raised.
 *
 * <p>The tracking state is read, decided on and overwritten under a lock per symbol and market,
 * so two evaluations of the same symbol cannot both emit from the same stale state. When the
 * tracking store is unreachable the crossing is emitted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CooldownEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AlertTrackingStore trackingStore;
    private final CooldownPolicy policy;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public CooldownDecision shouldEmit(String symbol, Market market, BigDecimal currentPrice, ThresholdCrossing crossing) {
        return shouldEmit(symbol, market, currentPrice, crossing, MarketDate.today(market, clock));
    }

    public CooldownDecision shouldEmit(
            String symbol, Market market, BigDecimal currentPrice, ThresholdCrossing crossing, MarketDate today) {
        var lock = locks.computeIfAbsent(CacheKeys.alertTracking(market, symbol), key -> new ReentrantLock());
        lock.lock();
        try {
            Optional<AlertTrackingState> tracked;
            try {
                tracked = trackingStore.find(market, symbol);
            } catch (TrackingStoreUnavailableException e) {
                log.warn("Emitting {} ({}) without cooldown check: {}", symbol, market, e.getMessage());
                return CooldownDecision.emit(CooldownReason.TRACKING_STORE_UNAVAILABLE);
            }

            var decision = decide(tracked, currentPrice, today);
            if (decision.emit()) {
                var highest = tracked
                        .map(state -> Math.max(state.highestThresholdFired(), crossing.threshold()))
                        .orElse(crossing.threshold());
                save(market, symbol, new AlertTrackingState(currentPrice, today.date(), highest, crossing.timeframe()));
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    private CooldownDecision decide(Optional<AlertTrackingState> tracked, BigDecimal currentPrice, MarketDate today) {
        if (tracked.isEmpty()) {
            return CooldownDecision.emit(CooldownReason.FIRST_ALERT);
        }
        var state = tracked.get();
        if (today.isAfter(state.lastAlertDate())) {
            return CooldownDecision.emit(CooldownReason.NEW_DAY);
        }
        if (furtherDrop(state.lastAlertPrice(), currentPrice).compareTo(policy.furtherDropPercent()) >= 0) {
            return CooldownDecision.emit(CooldownReason.FURTHER_DROP);
        }
        return CooldownDecision.suppress();
    }

    private static BigDecimal furtherDrop(BigDecimal lastAlertPrice, BigDecimal currentPrice) {
        if (lastAlertPrice.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return lastAlertPrice.subtract(currentPrice)
                .multiply(HUNDRED)
                .divide(lastAlertPrice, 6, RoundingMode.HALF_UP);
    }

    private void save(Market market, String symbol, AlertTrackingState state) {
        try {
            trackingStore.save(market, symbol, state);
        } catch (TrackingStoreUnavailableException e) {
            log.warn("Tracking state of {} ({}) not saved: {}", symbol, market, e.getMessage());
        }
    }
}
