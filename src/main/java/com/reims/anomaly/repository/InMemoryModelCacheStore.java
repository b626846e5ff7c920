package com.reims.anomaly.repository;

import com.reims.anomaly.model.CachedModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Process-local store. Records are copied on the way in and out so callers
 * cannot mutate stored state.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.model-cache.store", havingValue = "memory")
public class InMemoryModelCacheStore implements ModelCacheStore {

    private final Map<String, CachedModel> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CachedModel> get(String cacheKey) {
        CachedModel record = records.get(cacheKey);
        return Optional.ofNullable(record).map(CachedModel::copy);
    }

    @Override
    public void put(CachedModel model) {
        records.put(model.getCacheKey(), model.copy());
    }

    @Override
    public void touch(String cacheKey, Instant usedAt) {
        records.computeIfPresent(cacheKey, (key, record) -> record.toBuilder()
                .useCount(record.getUseCount() + 1)
                .lastUsedAt(usedAt)
                .build());
    }

    @Override
    public boolean deactivate(String cacheKey) {
        AtomicBoolean changed = new AtomicBoolean(false);
        records.computeIfPresent(cacheKey, (key, record) -> {
            if (!record.isActive()) return record;
            changed.set(true);
            return record.toBuilder().active(false).build();
        });
        return changed.get();
    }

    @Override
    public int deactivateMatching(Predicate<CachedModel> filter) {
        int count = 0;
        for (String key : new ArrayList<>(records.keySet())) {
            CachedModel record = records.get(key);
            if (record != null && record.isActive() && filter.test(record) && deactivate(key)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public List<CachedModel> findAll() {
        List<CachedModel> all = new ArrayList<>(records.size());
        for (CachedModel record : records.values()) {
            all.add(record.copy());
        }
        return all;
    }
}
