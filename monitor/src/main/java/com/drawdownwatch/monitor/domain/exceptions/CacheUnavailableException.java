package com.drawdownwatch.monitor.domain.exceptions;

public class CacheUnavailableException extends RuntimeException {

    private CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CacheUnavailableException of(String operation, String key, Throwable cause) {
        return new CacheUnavailableException(
                "Cache store unavailable during " + operation + " of " + key + ": " + cause.getMessage(), cause);
    }
}
