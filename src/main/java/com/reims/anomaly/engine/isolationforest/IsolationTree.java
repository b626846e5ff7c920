package com.reims.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(rows[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // constant on this feature: cannot be split further along it
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) leftCount++;
        }

        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.split(feature, splitValue,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
