package com.drawdownwatch.monitor.domain.cache;

import com.drawdownwatch.common.market.Market;

public record CacheStats(Market market, boolean connected, boolean snapshotCached, long keyCount) {}
