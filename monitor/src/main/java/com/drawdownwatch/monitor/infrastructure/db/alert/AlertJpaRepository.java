package com.drawdownwatch.monitor.infrastructure.db.alert;

import com.drawdownwatch.common.market.Market;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    List<AlertEntity> findByMarketOrderByTimestampDesc(Market market, Pageable pageable);
}
