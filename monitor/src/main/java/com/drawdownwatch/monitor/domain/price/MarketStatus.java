package com.drawdownwatch.monitor.domain.price;

import com.drawdownwatch.common.market.Market;

import java.time.Instant;

public record MarketStatus(Market market, boolean open, Instant checkedAt) {}
