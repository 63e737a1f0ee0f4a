package com.drawdownwatch.monitor.domain.recovery;

import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.alert.AlertNotifier;
import com.drawdownwatch.monitor.domain.alert.AlertRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Follows the price of an alerted symbol. The bottom only ever moves down; the recovery signal
 * fires the first time the price is the configured bounce above the bottom and never again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoveryTracker {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AlertRecordStore recordStore;
    private final AlertNotifier notifier;
    private final RecoveryPolicy policy;

    public RecoveryTrackingState observe(Alert alert, BigDecimal currentPrice) {
        var tracked = recordStore.findTrackingState(alert.id());
        var bottom = tracked.map(RecoveryTrackingState::bottomPrice).orElse(alert.price()).min(currentPrice);
        var recovery = currentPrice.subtract(bottom).multiply(HUNDRED).divide(bottom, 6, RoundingMode.HALF_UP);
        var alreadyNotified = tracked.map(RecoveryTrackingState::notified).orElse(false);
        var recovered = !alreadyNotified && recovery.compareTo(policy.bouncePercent()) >= 0;

        var state = recordStore.upsertTrackingState(RecoveryTrackingState.builder()
                .alertId(alert.id())
                .symbol(alert.symbol())
                .market(alert.market())
                .bottomPrice(bottom)
                .currentPrice(currentPrice)
                .recoveryPercentage(recovery.setScale(2, RoundingMode.HALF_UP))
                .notified(alreadyNotified || recovered)
                .build());

        if (recovered) {
            log.info("{} ({}) recovered {}% from bottom {} after alert {}",
                    alert.symbol(), alert.market(), state.recoveryPercentage(), bottom, alert.id());
            notifier.notifyRecovery(state);
        }
        return state;
    }
}
