package com.reims.anomaly.repository;

import com.reims.anomaly.model.CachedModel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence contract for trained models. Writes for one key are atomic:
 * concurrent {@link #put} calls for the same key leave exactly one of the
 * records, the last one written.
 */
public interface ModelCacheStore {

    Optional<CachedModel> get(String cacheKey);

    /** Insert or replace the record for {@code model.getCacheKey()}. */
    void put(CachedModel model);

    /** Increments useCount and sets lastUsedAt. No-op when the key is absent. */
    void touch(String cacheKey, Instant usedAt);

    /** Marks the record inactive; true if an active record was deactivated. */
    boolean deactivate(String cacheKey);

    /** Deactivates every active record matching {@code filter}; returns how many. */
    int deactivateMatching(Predicate<CachedModel> filter);

    List<CachedModel> findAll();
}
