package com.reims.anomaly.service;

import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.config.ModelCacheConfig;
import com.reims.anomaly.engine.density.LocalOutlierFactor;
import com.reims.anomaly.engine.density.LocalOutlierFactorCodec;
import com.reims.anomaly.engine.isolationforest.IsolationForest;
import com.reims.anomaly.engine.isolationforest.IsolationForestCodec;
import com.reims.anomaly.engine.model.ModelSerializer;
import com.reims.anomaly.exception.ModelTrainingException;
import com.reims.anomaly.model.AccuracyMetrics;
import com.reims.anomaly.model.CacheLookup;
import com.reims.anomaly.model.CacheStats;
import com.reims.anomaly.model.CachedModel;
import com.reims.anomaly.model.InvalidationDecision;
import com.reims.anomaly.model.ModelScope;
import com.reims.anomaly.repository.InMemoryModelCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelCacheServiceTest {

    private static final ModelScope SCOPE = ModelScope.of("PROP-001", "operating_expenses");
    private static final double[][] DATA = {
            {0.1, 0.0, 0.2}, {-0.2, 0.1, 0.0}, {0.0, -0.1, 0.1}, {0.3, 0.2, -0.1},
            {-0.1, 0.0, 0.0}, {0.2, -0.2, 0.1}, {0.0, 0.1, -0.2}, {5.0, 6.0, 4.0}
    };

    @Mock
    private MetricsConfig metricsConfig;

    private InMemoryModelCacheStore store;
    private ModelCacheConfig config;
    private MutableClock clock;
    private ModelCacheService service;
    private AtomicInteger trainings;

    @BeforeEach
    void setUp() {
        store = new InMemoryModelCacheStore();
        config = new ModelCacheConfig();
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        ModelSerializer serializer = new ModelSerializer(
                List.of(new IsolationForestCodec(), new LocalOutlierFactorCodec()));
        service = new ModelCacheService(store, serializer, config, metricsConfig, clock);
        trainings = new AtomicInteger();
    }

    private CacheLookup<IsolationForest> lookup(ModelScope scope, Map<String, ?> params) {
        return service.getOrTrain(scope, "isolation_forest", IsolationForest.class, () -> {
            trainings.incrementAndGet();
            return IsolationForest.train(DATA, 20, 8, 42L);
        }, params, DATA.length);
    }

    private static Map<String, Object> params(int trees) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("numTrees", trees);
        params.put("sampleSize", 8);
        return params;
    }

    @Test
    void getOrTrain_missThenHit() {
        CacheLookup<IsolationForest> first = lookup(SCOPE, params(20));
        CacheLookup<IsolationForest> second = lookup(SCOPE, params(20));

        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(trainings.get()).isEqualTo(1);
        assertThat(second.model().score(DATA[7])).isEqualTo(first.model().score(DATA[7]));

        CachedModel record = service.find(service.cacheKey(SCOPE, "isolation_forest", params(20))).orElseThrow();
        assertThat(record.getUseCount()).isEqualTo(1);
        assertThat(record.getTrainingDataSize()).isEqualTo(DATA.length);
        assertThat(record.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(30)));
        assertThat(record.getTrainingMetadata()).containsEntry("numTrees", 20);
        verify(metricsConfig).recordCacheLookup("miss");
        verify(metricsConfig).recordCacheLookup("hit");
    }

    @Test
    void cacheKey_isOrderIndependentAndConfigSensitive() {
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("sampleSize", 8);
        reversed.put("numTrees", 20);

        String key = service.cacheKey(SCOPE, "isolation_forest", params(20));

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
        assertThat(service.cacheKey(SCOPE, "isolation_forest", reversed)).isEqualTo(key);
        assertThat(service.cacheKey(SCOPE, "isolation_forest", params(21))).isNotEqualTo(key);
        assertThat(service.cacheKey(SCOPE, "lof", params(20))).isNotEqualTo(key);
        assertThat(service.cacheKey(ModelScope.of("PROP-002", "operating_expenses"), "isolation_forest", params(20)))
                .isNotEqualTo(key);
    }

    @Test
    void expiredRecord_isRetrained() {
        lookup(SCOPE, params(20));
        clock.advance(Duration.ofDays(31));

        CacheLookup<IsolationForest> after = lookup(SCOPE, params(20));

        assertThat(after.cacheHit()).isFalse();
        assertThat(trainings.get()).isEqualTo(2);
        CachedModel record = service.find(service.cacheKey(SCOPE, "isolation_forest", params(20))).orElseThrow();
        assertThat(record.isActive()).isTrue();
        assertThat(record.getCreatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void corruptRecord_isTreatedAsMissAndReplaced() {
        lookup(SCOPE, params(20));
        String key = service.cacheKey(SCOPE, "isolation_forest", params(20));
        CachedModel stored = service.find(key).orElseThrow();
        byte[] garbage = stored.getSerializedModel().clone();
        garbage[garbage.length - 3] ^= 0x7F;
        store.put(stored.toBuilder().serializedModel(garbage).build());

        CacheLookup<IsolationForest> after = lookup(SCOPE, params(20));

        assertThat(after.cacheHit()).isFalse();
        assertThat(trainings.get()).isEqualTo(2);
        verify(metricsConfig).recordCacheLookup("corrupt");
        assertThat(lookup(SCOPE, params(20)).cacheHit()).isTrue();
    }

    @Test
    void disabledCache_alwaysTrainsAndStoresNothing() {
        config.setEnabled(false);

        lookup(SCOPE, params(20));
        CacheLookup<IsolationForest> second = lookup(SCOPE, params(20));

        assertThat(second.cacheHit()).isFalse();
        assertThat(trainings.get()).isEqualTo(2);
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void trainingFailure_surfacesAsModelTrainingException() {
        assertThatThrownBy(() -> service.getOrTrain(SCOPE, "lof", LocalOutlierFactor.class,
                () -> LocalOutlierFactor.train(new double[][]{{1.0}}, 5), params(1), 1))
                .isInstanceOf(ModelTrainingException.class);

        assertThatThrownBy(() -> service.getOrTrain(SCOPE, "lof", LocalOutlierFactor.class,
                () -> { throw new IllegalStateException("boom"); }, params(1), 1))
                .isInstanceOf(ModelTrainingException.class)
                .hasMessageContaining("boom");

        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void invalidate_byEntityAndType() {
        lookup(SCOPE, params(20));
        lookup(ModelScope.of("PROP-002", "operating_expenses"), params(20));
        service.getOrTrain(SCOPE, "lof", LocalOutlierFactor.class,
                () -> LocalOutlierFactor.train(DATA, 3), Map.of("neighbors", 3), 8);

        assertThat(service.invalidate(ModelScope.of("PROP-001", null), "isolation_forest")).isEqualTo(1);
        assertThat(service.invalidate(ModelScope.of("PROP-001", null), "isolation_forest")).isZero();

        CacheStats stats = service.getCacheStats();
        assertThat(stats.getTotalModels()).isEqualTo(3);
        assertThat(stats.getActiveModels()).isEqualTo(2);
        verify(metricsConfig).recordCacheInvalidated(1);

        assertThat(service.invalidate(null, null)).isEqualTo(2);
        assertThat(service.getCacheStats().getActiveModels()).isZero();
    }

    @Test
    void invalidatedRecord_isRetrainedOnNextLookup() {
        lookup(SCOPE, params(20));
        service.invalidate(SCOPE, null);

        assertThat(lookup(SCOPE, params(20)).cacheHit()).isFalse();
        assertThat(trainings.get()).isEqualTo(2);
    }

    @Test
    void shouldInvalidate_rules() {
        CachedModel record = service.cacheModel(SCOPE, "isolation_forest", IsolationForest.train(DATA, 5, 8, 1L),
                params(5), DATA.length, AccuracyMetrics.builder().accuracy(0.90).build());

        InvalidationDecision keep = service.shouldInvalidate(record, 0.85, false);
        assertThat(keep.invalidate()).isFalse();
        assertThat(keep.reason()).isEqualTo("Cache valid");

        InvalidationDecision drop = service.shouldInvalidate(record, 0.75, false);
        assertThat(drop.invalidate()).isTrue();
        assertThat(drop.reason()).startsWith("Accuracy dropped");

        assertThat(service.shouldInvalidate(record, null, true).reason()).isEqualTo("Data distribution changed");

        clock.advance(Duration.ofDays(31));
        assertThat(service.shouldInvalidate(record, 0.90, false).reason()).isEqualTo("Cache expired");
    }

    @Test
    void shouldInvalidate_ageBeyondTtlEvenWithLongExpiry() {
        CachedModel record = CachedModel.builder()
                .cacheKey("k")
                .createdAt(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofDays(365)))
                .build();
        clock.advance(Duration.ofDays(45));

        InvalidationDecision decision = service.shouldInvalidate(record, null, false);

        assertThat(decision.invalidate()).isTrue();
        assertThat(decision.reason()).contains("exceeds TTL");
    }

    @Test
    void purgeExpired_deactivatesOnlyExpired() {
        lookup(SCOPE, params(20));
        clock.advance(Duration.ofDays(20));
        lookup(SCOPE, params(30));
        clock.advance(Duration.ofDays(15));

        assertThat(service.purgeExpired()).isEqualTo(1);
        CacheStats stats = service.getCacheStats();
        assertThat(stats.getActiveModels()).isEqualTo(1);
        assertThat(stats.getExpiredModels()).isEqualTo(1);
        assertThat(stats.isCacheEnabled()).isTrue();
    }

    @Test
    void concurrentMisses_leaveOneRecordPerKey() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CacheLookup<IsolationForest>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<CacheLookup<IsolationForest>> task = () -> {
                    start.await();
                    return lookup(SCOPE, params(20));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<CacheLookup<IsolationForest>> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).model()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.findAll()).hasSize(1);
        assertThat(trainings.get()).isBetween(1, threads);
        String key = service.cacheKey(SCOPE, "isolation_forest", params(20));
        assertThat(service.find(key)).isPresent();
        assertThat(lookup(SCOPE, params(20)).cacheHit()).isTrue();
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
