package com.drawdownwatch.monitor.support;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.alert.AlertRecordStore;
import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAlertRecordStore implements AlertRecordStore {

    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private final Map<String, RecoveryTrackingState> trackingStates = new ConcurrentHashMap<>();
    private final List<RecoveryTrackingState> trackingHistory = new CopyOnWriteArrayList<>();

    @Override
    public Alert insert(Alert alert) {
        alerts.add(alert);
        return alert;
    }

    @Override
    public List<Alert> findRecent(Market market, int limit) {
        return alerts.stream()
                .filter(alert -> alert.market() == market)
                .sorted(Comparator.comparing(Alert::timestamp).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<RecoveryTrackingState> findTrackingState(String alertId) {
        return Optional.ofNullable(trackingStates.get(alertId));
    }

    @Override
    public RecoveryTrackingState upsertTrackingState(RecoveryTrackingState state) {
        trackingStates.put(state.alertId(), state);
        trackingHistory.add(state);
        return state;
    }

    public List<Alert> alerts() {
        return new ArrayList<>(alerts);
    }

    public List<RecoveryTrackingState> trackingHistory(String alertId) {
        return trackingHistory.stream().filter(state -> state.alertId().equals(alertId)).toList();
    }
}
