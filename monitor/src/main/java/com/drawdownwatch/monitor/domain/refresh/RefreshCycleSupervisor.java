package com.drawdownwatch.monitor.domain.refresh;

import com.drawdownwatch.common.market.Market;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the refresh state of every market for the lifetime of the process.
 */
@Component
public class RefreshCycleSupervisor {

    private final Map<Market, RefreshCycleState> states;

    public RefreshCycleSupervisor() {
        var byMarket = new EnumMap<Market, RefreshCycleState>(Market.class);
        for (var market : Market.values()) {
            byMarket.put(market, new RefreshCycleState(market));
        }
        this.states = Collections.unmodifiableMap(byMarket);
    }

    public RefreshCycleState state(Market market) {
        return states.get(market);
    }
}
