package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.engine.seasonal.SeasonalAnalyzer;
import com.reims.anomaly.engine.seasonal.SeasonalExpectation;
import com.reims.anomaly.engine.statistical.StatisticalDetector;
import com.reims.anomaly.exception.InsufficientDataException;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.AnomalyType;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.model.StatisticType;
import com.reims.anomaly.model.TimeSeries;
import com.reims.anomaly.model.TimeSeriesPoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Compares each of the most recent points with the value the seasonal analyzer
 * expects from the history before it (trend plus same-period seasonal effect).
 *
 * Flags a point when its deviation from that expectation exceeds the percentage
 * change threshold. Emits percentage_change candidates, so it corroborates the
 * plain period-over-period check when both see the same jump.
 */
@Component
public class SeasonalDeviationDetector extends AbstractStatisticalDetector {

    private static final double SATURATION = 200.0;

    private final SeasonalAnalyzer seasonalAnalyzer;

    public SeasonalDeviationDetector(DetectionConfig config, SeasonalAnalyzer seasonalAnalyzer) {
        super(config);
        this.seasonalAnalyzer = seasonalAnalyzer;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.SEASONAL_DECOMPOSITION;
    }

    @Override
    protected List<AnomalyCandidate> findCandidates(TimeSeries series, DetectionContext context) {
        if (series.size() < StatisticalDetector.MIN_POINTS) {
            throw new InsufficientDataException(StatisticalDetector.MIN_POINTS, series.size());
        }

        double[] values = series.values();
        List<LocalDate> dates = series.dates();
        double threshold = config.getPercentageChangeThreshold();
        int first = Math.max(StatisticalDetector.MIN_POINTS, values.length - config.getSeasonalRecentPoints());

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = first; i < values.length; i++) {
            double[] history = Arrays.copyOfRange(values, 0, i);
            SeasonalExpectation expectation = seasonalAnalyzer.expectedValue(
                    history, dates.subList(0, i), dates.get(i), context.isUseSeasonality());

            double expected = expectation.getExpectedValue();
            if (expected == 0.0) continue;

            double pct = (values[i] - expected) / Math.abs(expected) * 100.0;
            if (Math.abs(pct) <= threshold) continue;

            TimeSeriesPoint point = series.get(i);
            candidates.add(AnomalyCandidate.builder()
                    .field(series.getField())
                    .anomalyType(AnomalyType.PERCENTAGE_CHANGE)
                    .method(DetectorKind.SEASONAL_DECOMPOSITION)
                    .severity(Math.abs(pct) > 100.0 ? Severity.HIGH : Severity.MEDIUM)
                    .periodKey(point.getPeriodKey())
                    .index(i)
                    .value(values[i])
                    .expectedValue(expected)
                    .statistic(pct)
                    .statisticType(StatisticType.PCT_CHANGE)
                    .confidence(Scores.confidenceFromMagnitude(pct, SATURATION))
                    .direction(pct > 0 ? "above" : "below")
                    .reason(String.format("Value %.2f deviates %.1f%% from seasonal expectation %.2f (%s)",
                            values[i], pct, expected, expectation.getMethod()))
                    .build());
        }
        return candidates;
    }
}
