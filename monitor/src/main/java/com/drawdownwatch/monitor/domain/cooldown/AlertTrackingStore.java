package com.drawdownwatch.monitor.domain.cooldown;

import com.drawdownwatch.common.market.Market;

import java.util.Optional;

/**
 * Holds one {@link AlertTrackingState} per symbol and market. Both operations throw
 * {@link com.drawdownwatch.monitor.domain.exceptions.TrackingStoreUnavailableException} when the
 * store cannot be reached.
 */
public interface AlertTrackingStore {

    Optional<AlertTrackingState> find(Market market, String symbol);

    void save(Market market, String symbol, AlertTrackingState state);
}
