package com.reims.anomaly.model;

/**
 * Result of a model cache lookup: the model and whether it came from the cache.
 */
public record CacheLookup<M>(M model, boolean cacheHit) {}
