package com.drawdownwatch.monitor.infrastructure.db.watchlist;

import com.drawdownwatch.common.market.Market;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface WatchlistJpaRepository extends JpaRepository<WatchlistEntity, Long> {

    @Query("""
            SELECT DISTINCT w.symbol FROM WatchlistEntity w
            WHERE w.market = :market AND w.active = true
            ORDER BY w.symbol
            """)
    List<String> findActiveSymbols(@Param("market") Market market);
}
