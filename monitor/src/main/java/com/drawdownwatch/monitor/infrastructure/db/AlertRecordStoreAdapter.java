package com.drawdownwatch.monitor.infrastructure.db;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.alert.AlertRecordStore;
import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;
import com.drawdownwatch.monitor.infrastructure.db.alert.AlertJpaRepository;
import com.drawdownwatch.monitor.infrastructure.db.alert.mapper.AlertEntityMapper;
import com.drawdownwatch.monitor.infrastructure.db.recovery.RecoveryTrackingJpaRepository;
import com.drawdownwatch.monitor.infrastructure.db.recovery.mapper.RecoveryTrackingEntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AlertRecordStoreAdapter implements AlertRecordStore {

    private final AlertJpaRepository alertJpaRepository;
    private final RecoveryTrackingJpaRepository recoveryTrackingJpaRepository;
    private final AlertEntityMapper alertMapper;
    private final RecoveryTrackingEntityMapper recoveryTrackingMapper;

    @Override
    @Transactional
    public Alert insert(Alert alert) {
        var saved = alertJpaRepository.save(alertMapper.toEntity(alert));
        return alertMapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findRecent(Market market, int limit) {
        return alertJpaRepository.findByMarketOrderByTimestampDesc(market, PageRequest.of(0, limit)).stream()
                .map(alertMapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RecoveryTrackingState> findTrackingState(String alertId) {
        return recoveryTrackingJpaRepository.findById(alertId).map(recoveryTrackingMapper::toDomain);
    }

    @Override
    @Transactional
    public RecoveryTrackingState upsertTrackingState(RecoveryTrackingState state) {
        var saved = recoveryTrackingJpaRepository.save(recoveryTrackingMapper.toEntity(state));
        return recoveryTrackingMapper.toDomain(saved);
    }
}
