package com.reims.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(String method, String status) {
        Counter.builder("detection.run.count")
                .tag("method", method)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordConsensus(String state) {
        Counter.builder("consensus.count")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordImpactScore(double impactScore) {
        DistributionSummary.builder("impact.score")
                .register(registry)
                .record(impactScore);
    }

    public void recordCacheLookup(String result) {
        Counter.builder("model_cache.lookup.count")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordCacheInvalidated(int count) {
        Counter.builder("model_cache.invalidated.count")
                .register(registry)
                .increment(count);
    }
}
