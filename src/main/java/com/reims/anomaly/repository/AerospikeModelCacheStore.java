package com.reims.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reims.anomaly.config.AerospikeConfig;
import com.reims.anomaly.model.AccuracyMetrics;
import com.reims.anomaly.model.CachedModel;
import com.reims.anomaly.model.ModelScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Model cache records in the {@code model_cache} set, one record per cache key.
 * The serialized model is stored as a blob bin; metadata and accuracy as JSON.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.model-cache.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeModelCacheStore implements ModelCacheStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeModelCacheStore.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy replacePolicy;
    private final WritePolicy updateOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeModelCacheStore(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();

        this.replacePolicy = new WritePolicy(writePolicy);
        this.replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;

        this.updateOnlyPolicy = new WritePolicy(writePolicy);
        this.updateOnlyPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
    }

    @Override
    public Optional<CachedModel> get(String cacheKey) {
        Record record = client.get(readPolicy, key(cacheKey));
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapRecord(cacheKey, record));
    }

    @Override
    public void put(CachedModel model) {
        ModelScope scope = model.getScope();
        client.put(replacePolicy, key(model.getCacheKey()),
                new Bin("cacheKey", model.getCacheKey()),
                new Bin("entityId", scope != null ? scope.entityId() : null),
                new Bin("field", scope != null ? scope.field() : null),
                new Bin("modelType", model.getModelType()),
                new Bin("model", model.getSerializedModel()),
                new Bin("metadata", toJson(model.getTrainingMetadata())),
                new Bin("createdAt", millis(model.getCreatedAt())),
                new Bin("expiresAt", millis(model.getExpiresAt())),
                new Bin("lastUsedAt", millis(model.getLastUsedAt())),
                new Bin("useCount", model.getUseCount()),
                new Bin("trainSize", model.getTrainingDataSize() != null ? model.getTrainingDataSize().longValue() : -1L),
                new Bin("accuracy", model.getAccuracyMetrics() != null ? toJson(model.getAccuracyMetrics()) : null),
                new Bin("active", model.isActive()));

        log.debug("Stored model cache record {} ({} bytes)", model.getCacheKey(),
                model.getSerializedModel() != null ? model.getSerializedModel().length : 0);
    }

    @Override
    public void touch(String cacheKey, Instant usedAt) {
        try {
            client.operate(updateOnlyPolicy, key(cacheKey),
                    Operation.add(new Bin("useCount", 1L)),
                    Operation.put(new Bin("lastUsedAt", usedAt.toEpochMilli())));
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_NOT_FOUND_ERROR) {
                throw e;
            }
        }
    }

    @Override
    public boolean deactivate(String cacheKey) {
        Record record = client.get(readPolicy, key(cacheKey), "active");
        if (record == null || !record.getBoolean("active")) {
            return false;
        }
        try {
            client.put(updateOnlyPolicy, key(cacheKey), new Bin("active", false));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public int deactivateMatching(Predicate<CachedModel> filter) {
        int count = 0;
        for (CachedModel model : findAll()) {
            if (model.isActive() && filter.test(model) && deactivate(model.getCacheKey())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public List<CachedModel> findAll() {
        List<CachedModel> models = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MODEL_CACHE,
                (key, record) -> {
                    String cacheKey = record.getString("cacheKey");
                    if (cacheKey == null) {
                        log.warn("Skipping model cache record without cacheKey bin");
                        return;
                    }
                    synchronized (models) {
                        models.add(mapRecord(cacheKey, record));
                    }
                });
        return models;
    }

    private CachedModel mapRecord(String cacheKey, Record record) {
        long trainSize = record.getLong("trainSize");
        String accuracyJson = record.getString("accuracy");
        return CachedModel.builder()
                .cacheKey(cacheKey)
                .scope(new ModelScope(record.getString("entityId"), record.getString("field")))
                .modelType(record.getString("modelType"))
                .serializedModel((byte[]) record.getValue("model"))
                .trainingMetadata(fromJson(record.getString("metadata")))
                .createdAt(instant(record.getLong("createdAt")))
                .expiresAt(instant(record.getLong("expiresAt")))
                .lastUsedAt(instant(record.getLong("lastUsedAt")))
                .useCount(record.getLong("useCount"))
                .trainingDataSize(trainSize >= 0 ? (int) trainSize : null)
                .accuracyMetrics(accuracyJson != null ? readAccuracy(accuracyJson) : null)
                .active(record.getBoolean("active"))
                .build();
    }

    private Key key(String cacheKey) {
        return new Key(namespace, AerospikeConfig.SET_MODEL_CACHE, cacheKey);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable model cache metadata", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null) return new HashMap<>();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable training metadata, ignoring: {}", e.getMessage());
            return new HashMap<>();
        }
    }

    private AccuracyMetrics readAccuracy(String json) {
        try {
            return objectMapper.readValue(json, AccuracyMetrics.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable accuracy metrics, ignoring: {}", e.getMessage());
            return null;
        }
    }

    private static long millis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : 0L;
    }

    private static Instant instant(long millis) {
        return millis > 0 ? Instant.ofEpochMilli(millis) : null;
    }
}
