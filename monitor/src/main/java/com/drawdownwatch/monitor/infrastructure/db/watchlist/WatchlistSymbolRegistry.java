package com.drawdownwatch.monitor.infrastructure.db.watchlist;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.price.ActiveSymbolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class WatchlistSymbolRegistry implements ActiveSymbolRegistry {

    private final WatchlistJpaRepository jpaRepository;

    @Override
    @Transactional(readOnly = true)
    public List<String> listActiveSymbols(Market market) {
        return jpaRepository.findActiveSymbols(market);
    }
}
