package com.reims.anomaly.service;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.exception.ConfigurationException;
import com.reims.anomaly.model.DetectorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorWeightRegistryTest {

    @Test
    void defaults_matchBuiltInWeights() {
        DetectorWeightRegistry registry = new DetectorWeightRegistry(new DetectionConfig());

        assertThat(registry.getWeight(DetectorKind.Z_SCORE)).isEqualTo(0.12);
        assertThat(registry.getWeight(DetectorKind.PERCENTAGE_CHANGE)).isEqualTo(0.08);
        assertThat(registry.getWeight(DetectorKind.CUSUM)).isEqualTo(0.10);
        assertThat(registry.getWeight(DetectorKind.VOLATILITY)).isEqualTo(0.10);
        assertThat(registry.getWeight(DetectorKind.SEASONAL_DECOMPOSITION)).isEqualTo(0.13);
        assertThat(registry.getWeight(DetectorKind.ISOLATION_FOREST)).isEqualTo(0.15);
        assertThat(registry.getWeight(DetectorKind.LOCAL_OUTLIER_FACTOR)).isEqualTo(0.12);
        assertThat(registry.snapshot()).hasSize(DetectorKind.values().length);
    }

    @Test
    void configuredWeights_overrideByCodeOrName() {
        DetectionConfig config = new DetectionConfig();
        config.getDetectorWeights().put("lof", 0.3);
        config.getDetectorWeights().put("ISOLATION_FOREST", 0.5);

        DetectorWeightRegistry registry = new DetectorWeightRegistry(config);

        assertThat(registry.getWeight(DetectorKind.LOCAL_OUTLIER_FACTOR)).isEqualTo(0.3);
        assertThat(registry.getWeight(DetectorKind.ISOLATION_FOREST)).isEqualTo(0.5);
        assertThat(registry.getMethodWeight("isolation-forest")).isEqualTo(0.5);
    }

    @Test
    void unknownMethodAtRuntime_getsFallbackWeight() {
        DetectorWeightRegistry registry = new DetectorWeightRegistry(new DetectionConfig());

        assertThat(registry.getMethodWeight("prophet")).isEqualTo(DetectorWeightRegistry.UNKNOWN_METHOD_WEIGHT);
        assertThat(registry.getMethodWeight(null)).isEqualTo(0.1);
    }

    @Test
    void unknownMethodInConfiguration_isRejected() {
        DetectionConfig config = new DetectionConfig();
        config.setDetectorWeights(Map.of("prophet", 0.2));

        assertThatThrownBy(() -> new DetectorWeightRegistry(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("prophet");
    }

    @Test
    void setMethodWeight_rejectsOutOfRange() {
        DetectorWeightRegistry registry = new DetectorWeightRegistry(new DetectionConfig());

        assertThatThrownBy(() -> registry.setMethodWeight("cusum", 1.5))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.setMethodWeight("cusum", -0.1))
                .isInstanceOf(ConfigurationException.class);
        assertThat(registry.getWeight(DetectorKind.CUSUM)).isEqualTo(0.10);

        registry.setMethodWeight("cusum", 0.0);
        assertThat(registry.getWeight(DetectorKind.CUSUM)).isZero();
    }

    @Test
    void snapshot_isReadOnly() {
        DetectorWeightRegistry registry = new DetectorWeightRegistry(new DetectionConfig());

        assertThatThrownBy(() -> registry.snapshot().put(DetectorKind.CUSUM, 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
