package com.reims.anomaly.config;

import com.reims.anomaly.exception.AnomalyDetectionException;
import com.reims.anomaly.exception.ConfigurationException;
import com.reims.anomaly.model.DetectorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionConfigTest {

    @Test
    void defaults_areValid() {
        DetectionConfig config = new DetectionConfig();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.getZscoreThreshold()).isEqualTo(3.0);
        assertThat(config.getMinAgreementCount()).isEqualTo(2);
        assertThat(config.getMaterialityFloor()).isEqualTo(100.0);
    }

    @Test
    void unknownWeightKey_isRejected() {
        DetectionConfig config = new DetectionConfig();
        config.getDetectorWeights().put("arima", 0.2);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("arima");
    }

    @Test
    void weightOutsideUnitInterval_isRejected() {
        DetectionConfig config = new DetectionConfig();
        config.getDetectorWeights().put("z_score", 1.2);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((AnomalyDetectionException) e).getErrorCode())
                        .isEqualTo("INVALID_CONFIGURATION"));
    }

    @Test
    void volatilityWindowBounds() {
        DetectionConfig tooSmall = new DetectionConfig();
        tooSmall.setVolatilityWindow(1);
        assertThatThrownBy(tooSmall::validate).isInstanceOf(ConfigurationException.class);

        DetectionConfig lookbackShorterThanWindow = new DetectionConfig();
        lookbackShorterThanWindow.setVolatilityWindow(6);
        lookbackShorterThanWindow.setVolatilityLookback(4);
        assertThatThrownBy(lookbackShorterThanWindow::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("volatility-lookback");
    }

    @Test
    void agreementAndThresholdBounds() {
        DetectionConfig noAgreement = new DetectionConfig();
        noAgreement.setMinAgreementCount(0);
        assertThatThrownBy(noAgreement::validate).isInstanceOf(ConfigurationException.class);

        DetectionConfig badThreshold = new DetectionConfig();
        badThreshold.setEnsembleConfidenceThreshold(1.5);
        assertThatThrownBy(badThreshold::validate).isInstanceOf(ConfigurationException.class);

        DetectionConfig negativeFloor = new DetectionConfig();
        negativeFloor.setMaterialityFloor(-1);
        assertThatThrownBy(negativeFloor::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("materiality-floor");
    }

    @Test
    void methodConfidence_defaultsAndOverrides() {
        DetectionConfig config = new DetectionConfig();
        assertThat(config.methodConfidenceFor(DetectorKind.ISOLATION_FOREST)).isEqualTo(0.85);

        config.getMethodConfidence().put("ISOLATION_FOREST", 0.7);
        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.methodConfidenceFor(DetectorKind.ISOLATION_FOREST)).isEqualTo(0.7);
        assertThat(config.methodConfidenceFor(DetectorKind.Z_SCORE)).isEqualTo(0.9);
    }

    @Test
    void methodConfidenceOutsideUnitInterval_isRejected() {
        DetectionConfig config = new DetectionConfig();
        config.getMethodConfidence().put("lof", 1.5);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Confidence for lof must be in [0,1], got 1.5");
    }
}
