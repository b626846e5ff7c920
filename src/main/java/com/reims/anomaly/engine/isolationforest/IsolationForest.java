package com.reims.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.reims.anomaly.engine.model.OutlierModel;
import com.reims.anomaly.exception.ModelTrainingException;
import com.reims.anomaly.model.DetectorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest (Liu, Ting and Zhou 2008). Points that random axis-aligned
 * splits isolate in few steps score close to 1.0; ordinary points stay near or
 * below 0.5.
 */
public class IsolationForest implements OutlierModel {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;
    private int featureCount;

    public IsolationForest() {}

    /**
     * @param data       one feature vector per row
     * @param numTrees   number of trees
     * @param sampleSize rows drawn (without replacement) per tree
     * @param seed       random seed; identical input and seed yield an identical forest
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data == null || data.length < 2) {
            throw new ModelTrainingException("Isolation forest needs at least 2 rows, got "
                    + (data == null ? 0 : data.length));
        }
        if (numTrees < 1 || sampleSize < 2) {
            throw new ModelTrainingException("Invalid forest size: " + numTrees + " trees, sample " + sampleSize);
        }

        IsolationForest forest = new IsolationForest();
        forest.sampleSize = Math.min(sampleSize, data.length);
        forest.featureCount = data[0].length;
        int maxDepth = (int) Math.ceil(Math.log(forest.sampleSize) / Math.log(2));

        Random random = new Random(seed);
        forest.trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            forest.trees.add(IsolationTree.grow(subsample(data, forest.sampleSize, random), maxDepth, random));
        }
        return forest;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)), in [0, 1].
     */
    @Override
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * How much the score drops when each feature is replaced by its typical value.
     */
    public double[] featureContributions(double[] point, double[] typical) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = typical[i];
            contributions[i] = Math.max(0, base - score(modified));
        }
        return contributions;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public int getFeatureCount() { return featureCount; }
    public void setFeatureCount(int featureCount) { this.featureCount = featureCount; }

    @JsonIgnore
    public int getTreeCount() { return trees.size(); }
}
