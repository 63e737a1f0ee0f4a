package com.drawdownwatch.monitor.infrastructure.gateway.dto;

import java.math.BigDecimal;
import java.util.List;

/** Last traded level of every NSE index, keyed by its display name such as {@code NIFTY 50}. */
public record NseAllIndicesResponse(List<IndexLevel> data) {

    public record IndexLevel(String index, BigDecimal last) {}
}
