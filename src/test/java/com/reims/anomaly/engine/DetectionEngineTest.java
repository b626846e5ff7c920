package com.reims.anomaly.engine;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.engine.detectors.CusumDetector;
import com.reims.anomaly.engine.detectors.ZScoreDetector;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.TimeSeries;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.reims.anomaly.testutil.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DetectionEngineTest {

    @Mock
    private MetricsConfig metricsConfig;

    private final DetectionContext context = DetectionContext.builder().entityId("PROP-001").build();

    private static AnomalyDetector failing(DetectorKind kind) {
        return new AnomalyDetector() {
            @Override
            public DetectorKind getKind() {
                return kind;
            }

            @Override
            public DetectionRun detect(TimeSeries series, DetectionContext context) {
                throw new IllegalStateException("boom");
            }
        };
    }

    @Test
    void runAll_runsEveryRegisteredDetector() {
        DetectionConfig config = new DetectionConfig();
        DetectionEngine engine = new DetectionEngine(
                List.of(new ZScoreDetector(config), new CusumDetector(config)), Tracer.NOOP, metricsConfig);

        List<DetectionRun> runs = engine.runAll(series(100, 101, 99, 100, 1000), context);

        assertThat(runs).extracting(DetectionRun::getMethod)
                .containsExactly(DetectorKind.Z_SCORE, DetectorKind.CUSUM);
        assertThat(engine.registeredKinds()).containsExactly(DetectorKind.Z_SCORE, DetectorKind.CUSUM);
        verify(metricsConfig).recordDetectionRun("z_score", "success");
    }

    @Test
    void failingDetector_isIsolated() {
        DetectionConfig config = new DetectionConfig();
        DetectionEngine engine = new DetectionEngine(
                List.of(failing(DetectorKind.VOLATILITY), new ZScoreDetector(config)), Tracer.NOOP, metricsConfig);

        List<DetectionRun> runs = engine.runAll(series(100, 101, 99, 100, 1000), context);

        assertThat(runs).hasSize(2);
        DetectionRun failed = runs.stream().filter(r -> r.getMethod() == DetectorKind.VOLATILITY).findFirst().orElseThrow();
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getReason()).isEqualTo("Detector error: boom");
        assertThat(failed.getCandidates()).isEmpty();
        DetectionRun zScore = runs.stream().filter(r -> r.getMethod() == DetectorKind.Z_SCORE).findFirst().orElseThrow();
        assertThat(zScore.isSuccess()).isTrue();
        verify(metricsConfig).recordDetectionRun("volatility", "error");
    }

    @Test
    void insufficientData_isReportedAsSkipped() {
        DetectionEngine engine = new DetectionEngine(
                List.of(new ZScoreDetector(new DetectionConfig())), Tracer.NOOP, metricsConfig);

        List<DetectionRun> runs = engine.runAll(series(100, 200), context);

        assertThat(runs).singleElement().satisfies(run -> assertThat(run.isSuccess()).isFalse());
        verify(metricsConfig).recordDetectionRun("z_score", "skipped");
    }

    @Test
    void laterDetectorOfSameKind_replacesEarlier() {
        DetectionConfig config = new DetectionConfig();
        DetectionEngine engine = new DetectionEngine(
                List.of(failing(DetectorKind.Z_SCORE), new ZScoreDetector(config)), Tracer.NOOP, metricsConfig);

        List<DetectionRun> runs = engine.runAll(series(100, 101, 99, 100, 1000), context);

        assertThat(runs).singleElement().satisfies(run -> assertThat(run.isSuccess()).isTrue());
    }
}
