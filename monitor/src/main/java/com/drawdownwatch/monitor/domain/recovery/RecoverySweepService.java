package com.drawdownwatch.monitor.domain.recovery;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.alert.AlertRecordStore;
import com.drawdownwatch.monitor.domain.price.PriceReadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecoverySweepService {

    private final AlertRecordStore recordStore;
    private final PriceReadService priceReadService;
    private final RecoveryTracker recoveryTracker;
    private final RecoveryPolicy policy;

    /**
     * Observes the cached price of every recent alert of the market.
     *
     * @return number of alerts observed
     */
    public int sweep(Market market) {
        var alerts = recordStore.findRecent(market, policy.sweepLimit());
        var observed = 0;
        for (var alert : alerts) {
            try {
                var price = priceReadService.cachedPrice(alert.symbol(), market);
                if (price.isEmpty()) {
                    log.debug("No cached price for {} ({}), skipping alert {}", alert.symbol(), market, alert.id());
                    continue;
                }
                recoveryTracker.observe(alert, price.get().price());
                observed++;
            } catch (RuntimeException e) {
                log.warn("Recovery check for alert {} failed: {}", alert.id(), e.getMessage());
            }
        }
        log.debug("Recovery sweep for {} observed {}/{} alerts", market, observed, alerts.size());
        return observed;
    }
}
