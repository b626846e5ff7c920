package com.reims.anomaly.engine.density;

import com.reims.anomaly.exception.ModelTrainingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LocalOutlierFactorTest {

    private static double[][] gridWithOutlier() {
        double[][] data = new double[17][];
        int i = 0;
        for (int x = 0; x < 4; x++) {
            for (int y = 0; y < 4; y++) {
                data[i++] = new double[]{x, y};
            }
        }
        data[16] = new double[]{20, 20};
        return data;
    }

    @Test
    void isolatedPoint_hasHighFactor() {
        double[][] data = gridWithOutlier();
        LocalOutlierFactor lof = LocalOutlierFactor.train(data, 4);

        assertThat(lof.score(data[16])).isGreaterThan(1.5);
        assertThat(lof.score(data[5])).isCloseTo(1.0, within(0.5));
    }

    @Test
    void unseenPoint_scoredAgainstTrainingSet() {
        LocalOutlierFactor lof = LocalOutlierFactor.train(gridWithOutlier(), 4);

        assertThat(lof.score(new double[]{1.5, 1.5})).isLessThan(1.5);
        assertThat(lof.score(new double[]{-15, 3})).isGreaterThan(1.5);
    }

    @Test
    void duplicatePoints_stayFinite() {
        double[][] data = {{1, 1}, {1, 1}, {1, 1}, {1, 1}, {5, 5}};
        LocalOutlierFactor lof = LocalOutlierFactor.train(data, 3);

        assertThat(lof.score(data[0])).isFinite();
        assertThat(lof.score(data[4])).isFinite().isGreaterThan(1.5);
    }

    @Test
    void neighboursCappedAtRowsMinusOne() {
        LocalOutlierFactor lof = LocalOutlierFactor.train(new double[][]{{0}, {1}, {2}}, 10);

        assertThat(lof.getNeighbors()).isEqualTo(2);
    }

    @Test
    void train_needsThreeRows() {
        assertThatThrownBy(() -> LocalOutlierFactor.train(new double[][]{{0}, {1}}, 2))
                .isInstanceOf(ModelTrainingException.class)
                .hasMessageContaining("at least 3");
    }
}
