package com.drawdownwatch.monitor.infrastructure.db.recovery;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RecoveryTrackingJpaRepository extends JpaRepository<RecoveryTrackingEntity, String> {
}
