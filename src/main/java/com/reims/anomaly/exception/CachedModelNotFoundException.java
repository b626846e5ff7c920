package com.reims.anomaly.exception;

public class CachedModelNotFoundException extends AnomalyDetectionException {
    public CachedModelNotFoundException(String cacheKey) {
        super("CACHED_MODEL_NOT_FOUND", "No cached model with key '" + cacheKey + "'.");
    }
}
