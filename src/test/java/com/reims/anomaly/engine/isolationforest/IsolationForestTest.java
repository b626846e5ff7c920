package com.reims.anomaly.engine.isolationforest;

import com.reims.anomaly.exception.ModelTrainingException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestTest {

    static double[][] clusterWithOutlier() {
        Random random = new Random(7);
        double[][] data = new double[64][3];
        for (int i = 0; i < data.length - 1; i++) {
            for (int f = 0; f < 3; f++) {
                data[i][f] = random.nextGaussian() * 0.5;
            }
        }
        data[data.length - 1] = new double[]{8.0, 9.0, 7.5};
        return data;
    }

    @Test
    void outlierScoresHigherThanClusterPoints() {
        double[][] data = clusterWithOutlier();
        IsolationForest forest = IsolationForest.train(data, 100, 64, 42L);

        double outlier = forest.score(data[data.length - 1]);
        double inlier = forest.score(new double[]{0.0, 0.0, 0.0});

        assertThat(outlier).isGreaterThan(0.6);
        assertThat(outlier).isGreaterThan(inlier);
        assertThat(inlier).isBetween(0.0, 0.6);
        assertThat(forest.getTreeCount()).isEqualTo(100);
        assertThat(forest.getFeatureCount()).isEqualTo(3);
    }

    @Test
    void sameSeed_sameScores() {
        double[][] data = clusterWithOutlier();
        IsolationForest a = IsolationForest.train(data, 50, 32, 11L);
        IsolationForest b = IsolationForest.train(data, 50, 32, 11L);

        for (double[] row : data) {
            assertThat(a.score(row)).isEqualTo(b.score(row));
        }
    }

    @Test
    void sampleSize_cappedAtRows() {
        IsolationForest forest = IsolationForest.train(clusterWithOutlier(), 10, 256, 1L);

        assertThat(forest.getSampleSize()).isEqualTo(64);
    }

    @Test
    void featureContributions_pointToTheDeviatingFeature() {
        double[][] data = clusterWithOutlier();
        IsolationForest forest = IsolationForest.train(data, 100, 64, 42L);

        double[] contributions = forest.featureContributions(new double[]{9.0, 0.0, 0.0}, FeatureExtractor.TYPICAL);

        assertThat(contributions[0]).isGreaterThan(contributions[1]);
        assertThat(contributions[0]).isGreaterThan(contributions[2]);
    }

    @Test
    void train_rejectsDegenerateInput() {
        assertThatThrownBy(() -> IsolationForest.train(new double[][]{{1.0}}, 10, 8, 1L))
                .isInstanceOf(ModelTrainingException.class);
        assertThatThrownBy(() -> IsolationForest.train(clusterWithOutlier(), 0, 8, 1L))
                .isInstanceOf(ModelTrainingException.class);
    }
}
