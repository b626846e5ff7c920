package com.reims.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.config.ModelCacheConfig;
import com.reims.anomaly.engine.model.ModelSerializer;
import com.reims.anomaly.engine.model.OutlierModel;
import com.reims.anomaly.exception.CacheCorruptionException;
import com.reims.anomaly.exception.ModelTrainingException;
import com.reims.anomaly.model.AccuracyMetrics;
import com.reims.anomaly.model.CacheLookup;
import com.reims.anomaly.model.CacheStats;
import com.reims.anomaly.model.CachedModel;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.InvalidationDecision;
import com.reims.anomaly.model.ModelScope;
import com.reims.anomaly.repository.ModelCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Trains models on demand and reuses them until they expire.
 *
 * The cache key is the SHA-256 of scope, model type and the training
 * configuration rendered as JSON with sorted keys, so equal configurations
 * share a key regardless of map order. Concurrent misses for one key may
 * both train; the store keeps the last write.
 */
@Service
public class ModelCacheService {

    private static final Logger log = LoggerFactory.getLogger(ModelCacheService.class);

    private final ModelCacheStore store;
    private final ModelSerializer serializer;
    private final ModelCacheConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ObjectMapper canonicalMapper;

    public ModelCacheService(ModelCacheStore store, ModelSerializer serializer, ModelCacheConfig config,
                             MetricsConfig metricsConfig, Clock clock) {
        this.store = store;
        this.serializer = serializer;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.canonicalMapper = JsonMapper.builder()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .build();
    }

    public String cacheKey(ModelScope scope, String modelType, Map<String, ?> trainingConfig) {
        String canonical = scope.canonical() + "|model_type:" + modelType + "|" + canonicalJson(trainingConfig);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the cached model for this key when an active, unexpired, readable
     * record exists; otherwise trains with {@code trainFn} and stores the result.
     * A record that fails to deserialize is deactivated and replaced.
     *
     * @throws ModelTrainingException when training fails
     */
    public <M extends OutlierModel> CacheLookup<M> getOrTrain(ModelScope scope, String modelType,
                                                             Class<M> modelClass,
                                                             Supplier<M> trainFn,
                                                             Map<String, ?> trainingConfig,
                                                             Integer trainingDataSize) {
        DetectorKind kind = DetectorKind.resolve(modelType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown model type: " + modelType));

        if (!config.isEnabled()) {
            return new CacheLookup<>(train(trainFn, modelType), false);
        }

        String key = cacheKey(scope, modelType, trainingConfig);
        Instant now = clock.instant();
        Optional<CachedModel> existing = store.get(key);

        if (existing.isPresent()) {
            CachedModel record = existing.get();
            if (record.isActive() && !record.isExpired(now)) {
                try {
                    M model = serializer.deserialize(record.getSerializedModel(), kind, modelClass);
                    store.touch(key, now);
                    metricsConfig.recordCacheLookup("hit");
                    log.debug("Model cache hit for {} {} ({})", modelType, scope.canonical(), key);
                    return new CacheLookup<>(model, true);
                } catch (CacheCorruptionException e) {
                    log.warn("Corrupt cached {} model {}: {}. Retraining.", modelType, key, e.getMessage());
                    store.deactivate(key);
                    metricsConfig.recordCacheLookup("corrupt");
                }
            } else if (record.isActive()) {
                log.info("Cached {} model {} expired at {}. Retraining.", modelType, key, record.getExpiresAt());
                store.deactivate(key);
                metricsConfig.recordCacheLookup("expired");
            } else {
                metricsConfig.recordCacheLookup("miss");
            }
        } else {
            metricsConfig.recordCacheLookup("miss");
        }

        M model = train(trainFn, modelType);
        cacheModel(scope, modelType, model, trainingConfig, trainingDataSize, null);
        return new CacheLookup<>(model, false);
    }

    /**
     * Serializes and upserts a trained model under its cache key.
     */
    public CachedModel cacheModel(ModelScope scope, String modelType, OutlierModel model,
                                  Map<String, ?> trainingConfig, Integer trainingDataSize,
                                  AccuracyMetrics accuracyMetrics) {
        Instant now = clock.instant();
        String key = cacheKey(scope, modelType, trainingConfig);

        Map<String, Object> metadata = new HashMap<>();
        if (trainingConfig != null) {
            metadata.putAll(trainingConfig);
        }
        metadata.put("formatVersion", 1);

        CachedModel record = CachedModel.builder()
                .cacheKey(key)
                .scope(scope)
                .modelType(modelType)
                .serializedModel(serializer.serialize(model))
                .trainingMetadata(metadata)
                .trainingDataSize(trainingDataSize)
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofDays(config.getTtlDays())))
                .lastUsedAt(now)
                .useCount(0)
                .accuracyMetrics(accuracyMetrics)
                .active(true)
                .build();

        store.put(record);
        log.info("Cached {} model for {} ({} bytes, expires {})",
                modelType, scope.canonical(), record.getSerializedModel().length, record.getExpiresAt());
        return record;
    }

    /**
     * Deactivates active records matching the scope and model type. Null scope
     * components and a null model type match everything.
     *
     * @return number of records deactivated
     */
    public int invalidate(ModelScope scope, String modelType) {
        int count = store.deactivateMatching(record ->
                (scope == null || (record.getScope() != null && scope.covers(record.getScope())))
                        && (modelType == null || modelType.equals(record.getModelType())));
        if (count > 0) {
            metricsConfig.recordCacheInvalidated(count);
        }
        log.info("Invalidated {} cached model(s) for scope={} modelType={}",
                count, scope != null ? scope.canonical() : "all", modelType != null ? modelType : "all");
        return count;
    }

    /**
     * Whether a record should be retrained. Checks, in order: expiry, age beyond
     * the TTL, an accuracy drop larger than the configured tolerance, and a
     * reported change in the data distribution.
     */
    public InvalidationDecision shouldInvalidate(CachedModel record, Double newAccuracy, boolean distributionChanged) {
        Instant now = clock.instant();
        if (record.isExpired(now)) {
            return InvalidationDecision.because("Cache expired");
        }
        if (record.getCreatedAt() != null) {
            long ageDays = Duration.between(record.getCreatedAt(), now).toDays();
            if (ageDays > config.getTtlDays()) {
                return InvalidationDecision.because(
                        String.format("Cache age %d days exceeds TTL %d", ageDays, config.getTtlDays()));
            }
        }
        AccuracyMetrics metrics = record.getAccuracyMetrics();
        if (newAccuracy != null && metrics != null && metrics.getAccuracy() != null) {
            double drop = metrics.getAccuracy() - newAccuracy;
            if (drop > config.getMaxAccuracyDrop()) {
                return InvalidationDecision.because(String.format(
                        "Accuracy dropped by %.3f (%.3f -> %.3f)", drop, metrics.getAccuracy(), newAccuracy));
            }
        }
        if (distributionChanged) {
            return InvalidationDecision.because("Data distribution changed");
        }
        return InvalidationDecision.keep();
    }

    public Optional<CachedModel> find(String cacheKey) {
        return store.get(cacheKey);
    }

    public CacheStats getCacheStats() {
        Instant now = clock.instant();
        List<CachedModel> records = store.findAll();
        long active = 0;
        long expired = 0;
        long uses = 0;
        for (CachedModel record : records) {
            if (record.isActive()) active++;
            if (record.isExpired(now)) expired++;
            uses += record.getUseCount();
        }
        return CacheStats.builder()
                .totalModels(records.size())
                .activeModels(active)
                .expiredModels(expired)
                .totalUses(uses)
                .cacheEnabled(config.isEnabled())
                .build();
    }

    @Scheduled(fixedDelayString = "${anomaly.model-cache.maintenance-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public void scheduledPurge() {
        purgeExpired();
    }

    /**
     * Deactivates records past their expiry so they stop counting as active.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int count = store.deactivateMatching(record -> record.isExpired(now));
        if (count > 0) {
            log.info("Deactivated {} expired cached model(s)", count);
            metricsConfig.recordCacheInvalidated(count);
        }
        return count;
    }

    private <M extends OutlierModel> M train(Supplier<M> trainFn, String modelType) {
        long start = System.currentTimeMillis();
        M model;
        try {
            model = trainFn.get();
        } catch (ModelTrainingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelTrainingException("Training " + modelType + " failed: " + e.getMessage(), e);
        }
        if (model == null) {
            throw new ModelTrainingException("Training " + modelType + " produced no model");
        }
        log.debug("Trained {} model in {}ms", modelType, System.currentTimeMillis() - start);
        return model;
    }

    private String canonicalJson(Map<String, ?> trainingConfig) {
        try {
            Map<String, Object> sorted = new TreeMap<>();
            if (trainingConfig != null) {
                sorted.putAll(trainingConfig);
            }
            return canonicalMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Training configuration is not serializable", e);
        }
    }
}
