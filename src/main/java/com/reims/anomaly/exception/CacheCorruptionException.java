package com.reims.anomaly.exception;

public class CacheCorruptionException extends AnomalyDetectionException {
    public CacheCorruptionException(String message) {
        super("CACHE_CORRUPTION", message);
    }
    public CacheCorruptionException(String message, Throwable cause) {
        super("CACHE_CORRUPTION", message, cause);
    }
}
