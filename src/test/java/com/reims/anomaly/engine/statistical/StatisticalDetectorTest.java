package com.reims.anomaly.engine.statistical;

import com.reims.anomaly.exception.InsufficientDataException;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.AnomalyType;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.model.StatisticType;
import com.reims.anomaly.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.reims.anomaly.testutil.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticalDetectorTest {

    @Test
    void zScore_singleSpike_flagsOnlyTheSpike() {
        TimeSeries s = series(100, 102, 98, 101, 1000, 99);

        List<AnomalyCandidate> candidates = StatisticalDetector.detectZScore(s, 3.0);

        assertThat(candidates).hasSize(1);
        AnomalyCandidate spike = candidates.get(0);
        assertThat(spike.getIndex()).isEqualTo(4);
        assertThat(spike.getValue()).isEqualTo(1000.0);
        assertThat(spike.getStatistic()).isGreaterThan(3.0);
        assertThat(spike.getStatisticType()).isEqualTo(StatisticType.Z_SCORE);
        assertThat(spike.getSeverity()).isEqualTo(Severity.HIGH);
        // baseline is the other five points
        assertThat(spike.getExpectedValue()).isCloseTo(100.0, within(1e-9));
        assertThat(spike.getConfidence()).isCloseTo(0.95, within(1e-9));
        assertThat(spike.getDirection()).isEqualTo("above");
    }

    @Test
    void zScore_constantSeries_neverFlags() {
        TimeSeries s = series(5, 5, 5, 5, 5, 5);

        assertThat(StatisticalDetector.detectZScore(s, 3.0)).isEmpty();
        assertThat(StatisticalDetector.detectZScore(s, 0.0)).isEmpty();
        assertThat(StatisticalDetector.detectZScore(s, 0.001)).isEmpty();
    }

    @Test
    void zScore_tooFewNonZeroPoints_throws() {
        assertThatThrownBy(() -> StatisticalDetector.detectZScore(series(0, 0, 7, 0), 3.0))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("need at least 3");
    }

    @Test
    void percentageChange_flagsJumpWithSign() {
        TimeSeries s = series(100, 100, 180, 170, 40);

        List<AnomalyCandidate> candidates = StatisticalDetector.detectPercentageChange(s, 50.0);

        assertThat(candidates).extracting(AnomalyCandidate::getIndex).containsExactly(2, 4);
        AnomalyCandidate rise = candidates.get(0);
        assertThat(rise.getStatistic()).isCloseTo(80.0, within(1e-9));
        assertThat(rise.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(rise.getDirection()).isEqualTo("increase");
        assertThat(rise.getExpectedValue()).isEqualTo(100.0);

        AnomalyCandidate drop = candidates.get(1);
        assertThat(drop.getStatistic()).isNegative();
        assertThat(drop.getDirection()).isEqualTo("decrease");
    }

    @Test
    void percentageChange_skipsZeroPrevious() {
        TimeSeries s = series(0, 500, 510, 505);

        assertThat(StatisticalDetector.detectPercentageChange(s, 50.0)).isEmpty();
    }

    @Test
    void percentageChange_aboveHundredPercent_isHigh() {
        List<AnomalyCandidate> candidates = StatisticalDetector.detectPercentageChange(series(100, 100, 250), 50.0);

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void cusum_levelShift_flagsBothRegimes() {
        TimeSeries s = series(10, 10, 10, 10, 10, 10, 10, 10, 20, 20, 20, 20, 20, 20, 20, 20);

        List<AnomalyCandidate> candidates = StatisticalDetector.detectCusum(s, 3.0, 0.5);

        assertThat(candidates).isNotEmpty();
        assertThat(candidates).allMatch(c -> c.getAnomalyType() == AnomalyType.LEVEL_SHIFT);
        assertThat(candidates).allMatch(c -> c.getStatistic() >= 3.0);
        assertThat(candidates).anyMatch(c -> c.getDirection().equals("downward_shift") && c.getIndex() == 7);
        assertThat(candidates).anyMatch(c -> c.getDirection().equals("upward_shift") && c.getIndex() == 15);
    }

    @Test
    void cusum_needsFivePoints() {
        assertThatThrownBy(() -> StatisticalDetector.detectCusum(series(1, 2, 3, 4), 3.0, 0.5))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void cusum_constantSeries_noCandidates() {
        assertThat(StatisticalDetector.detectCusum(series(3, 3, 3, 3, 3, 3), 3.0, 0.5)).isEmpty();
    }

    @Test
    void cusumSeverity_bands() {
        assertThat(StatisticalDetector.cusumSeverity(3.2)).isEqualTo(Severity.MEDIUM);
        assertThat(StatisticalDetector.cusumSeverity(5.0)).isEqualTo(Severity.HIGH);
        assertThat(StatisticalDetector.cusumSeverity(6.0)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void volatility_spikeWindows_areCritical() {
        TimeSeries s = series(100, 101, 100, 101, 100, 101, 100, 101, 100, 150, 100, 101);

        List<AnomalyCandidate> candidates = StatisticalDetector.detectVolatility(s, 3, 12);

        assertThat(candidates).extracting(AnomalyCandidate::getIndex).containsExactly(9, 10, 11);
        assertThat(candidates).allMatch(c -> c.getSeverity() == Severity.CRITICAL);
        assertThat(candidates).allMatch(c -> c.getStatisticType() == StatisticType.VOLATILITY_RATIO);
        // mean of the full window ending at the flagged point
        assertThat(candidates.get(0).getExpectedValue()).isCloseTo((101 + 100 + 150) / 3.0, within(1e-9));
        assertThat(candidates.get(1).getExpectedValue()).isCloseTo((100 + 150 + 100) / 3.0, within(1e-9));
        assertThat(candidates.get(2).getExpectedValue()).isCloseTo((150 + 100 + 101) / 3.0, within(1e-9));
    }

    @Test
    void volatility_onlyLooksAtLookback() {
        // the early spike falls outside the last 6 points
        TimeSeries s = series(100, 900, 100, 101, 100, 101, 100, 101, 100, 101);

        assertThat(StatisticalDetector.detectVolatility(s, 3, 6)).isEmpty();
    }

    @Test
    void volatility_needsTwoWindows() {
        assertThatThrownBy(() -> StatisticalDetector.detectVolatility(series(1, 2, 3, 4, 5), 3, 12))
                .isInstanceOf(InsufficientDataException.class);
    }
}
