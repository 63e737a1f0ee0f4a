package com.drawdownwatch.monitor.infrastructure.gateway.dto;

import java.math.BigDecimal;
import java.util.List;

public record YahooChartResponse(Chart chart) {

    public record Chart(List<Result> result) {}

    public record Result(Meta meta, List<Long> timestamp, Indicators indicators) {}

    public record Meta(String symbol, BigDecimal regularMarketPrice, Long regularMarketTime) {}

    public record Indicators(List<Quote> quote) {}

    public record Quote(List<BigDecimal> close) {}
}
