package com.drawdownwatch.monitor.domain.alert;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;

import java.util.List;
import java.util.Optional;

/**
 * Durable log of raised alerts and of the recovery tracking row attached to each alert.
 */
public interface AlertRecordStore {

    Alert insert(Alert alert);

    /** Newest first. */
    List<Alert> findRecent(Market market, int limit);

    Optional<RecoveryTrackingState> findTrackingState(String alertId);

    RecoveryTrackingState upsertTrackingState(RecoveryTrackingState state);
}
