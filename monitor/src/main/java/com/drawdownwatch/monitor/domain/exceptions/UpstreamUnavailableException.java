package com.drawdownwatch.monitor.domain.exceptions;

import com.drawdownwatch.common.market.Market;

public class UpstreamUnavailableException extends RuntimeException {

    private UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UpstreamUnavailableException of(String source, String symbol, Market market, Throwable cause) {
        return new UpstreamUnavailableException(
                source + " unavailable for " + symbol + " (" + market + "): " + cause.getMessage(), cause);
    }

    public static UpstreamUnavailableException emptyResponse(String source, String symbol, Market market) {
        return new UpstreamUnavailableException(
                source + " returned no data for " + symbol + " (" + market + ")", null);
    }
}
