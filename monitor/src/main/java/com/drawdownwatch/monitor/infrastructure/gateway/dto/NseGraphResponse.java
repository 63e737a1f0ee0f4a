package com.drawdownwatch.monitor.infrastructure.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Intraday-to-yearly chart of one index. Each point is {@code [epochMillis, level, flag]}; the
 * field name carries the upstream's own spelling.
 */
public record NseGraphResponse(Data data) {

    public record Data(@JsonProperty("grapthData") List<List<Object>> graphData) {}
}
