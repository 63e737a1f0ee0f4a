package com.drawdownwatch.monitor.domain.cache;

public enum CacheTier {
    CURRENT_SNAPSHOT("current-snapshot"),
    LATEST("latest"),
    HISTORY("history"),
    RECENT("recent"),
    MARKET_STATUS("status");

    private final String segment;

    CacheTier(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}
