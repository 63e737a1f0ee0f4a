package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;

import java.util.List;

public interface ActiveSymbolRegistry {

    List<String> listActiveSymbols(Market market);
}
