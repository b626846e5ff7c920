package com.reims.anomaly.engine;

import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.TimeSeries;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every registered detector over a series.
 * Uses the Strategy pattern: each DetectorKind is handled by one registered AnomalyDetector.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectorKind, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(DetectorKind.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (AnomalyDetector detector : detectors) {
            AnomalyDetector previous = detectorMap.put(detector.getKind(), detector);
            if (previous != null) {
                log.warn("Detector {} replaced {} for kind {}",
                        detector.getClass().getSimpleName(), previous.getClass().getSimpleName(), detector.getKind());
            }
            log.info("Registered detector: {} -> {}", detector.getKind(), detector.getClass().getSimpleName());
        }
    }

    public Set<DetectorKind> registeredKinds() {
        return Collections.unmodifiableSet(detectorMap.keySet());
    }

    /**
     * Run all registered detectors against the series. A detector that throws is
     * reported as a failed run; the others still run.
     */
    @Observed(name = "detectors.run_all", contextualName = "run-all-detectors")
    public List<DetectionRun> runAll(TimeSeries series, DetectionContext context) {
        List<DetectionRun> runs = new ArrayList<>(detectorMap.size());

        for (AnomalyDetector detector : detectorMap.values()) {
            DetectorKind kind = detector.getKind();
            Span span = tracer.nextSpan()
                    .name("detector.run." + kind.getCode())
                    .tag("detector.kind", kind.getCode())
                    .tag("series.field", series.getField())
                    .tag("series.size", String.valueOf(series.size()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                DetectionRun run = detector.detect(series, context);
                runs.add(run);

                span.tag("detector.success", String.valueOf(run.isSuccess()));
                span.tag("detector.candidates", String.valueOf(run.getCandidates().size()));
                metricsConfig.recordDetectionRun(kind.getCode(), run.isSuccess() ? "success" : "skipped");

                log.debug("Detector {} on {}/{}: {} ({} candidates)",
                        kind.getCode(), context.getEntityId(), series.getField(),
                        run.getReason(), run.getCandidates().size());
            } catch (Exception e) {
                span.error(e);
                log.error("Detector {} failed on {}/{}: {}",
                        kind.getCode(), context.getEntityId(), series.getField(), e.getMessage(), e);
                runs.add(DetectionRun.failed(kind, "Detector error: " + e.getMessage()));
                metricsConfig.recordDetectionRun(kind.getCode(), "error");
            } finally {
                span.end();
            }
        }

        return runs;
    }
}
