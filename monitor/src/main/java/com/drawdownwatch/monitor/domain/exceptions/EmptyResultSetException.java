package com.drawdownwatch.monitor.domain.exceptions;

import com.drawdownwatch.common.market.Market;

public class EmptyResultSetException extends RuntimeException {

    private EmptyResultSetException(String message) {
        super(message);
    }

    public static EmptyResultSetException of(Market market, int requestedSymbols) {
        return new EmptyResultSetException(
                "No prices fetched for " + market + " (" + requestedSymbols + " symbols requested)");
    }
}
