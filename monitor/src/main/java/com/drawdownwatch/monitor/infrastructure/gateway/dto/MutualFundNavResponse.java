package com.drawdownwatch.monitor.infrastructure.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** NAV history of one scheme, newest first. Dates are {@code dd-MM-yyyy}, NAVs decimal strings. */
public record MutualFundNavResponse(String status, Meta meta, List<NavPoint> data) {

    public record Meta(
            @JsonProperty("scheme_code") Long schemeCode,
            @JsonProperty("scheme_name") String schemeName) {}

    public record NavPoint(String date, String nav) {}
}
