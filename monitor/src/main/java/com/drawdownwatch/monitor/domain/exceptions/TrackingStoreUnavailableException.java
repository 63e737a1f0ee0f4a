package com.drawdownwatch.monitor.domain.exceptions;

public class TrackingStoreUnavailableException extends RuntimeException {

    private TrackingStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TrackingStoreUnavailableException of(String key, Throwable cause) {
        return new TrackingStoreUnavailableException(
                "Alert tracking store unavailable for " + key + ": " + cause.getMessage(), cause);
    }
}
