package com.reims.anomaly.engine.density;

import com.reims.anomaly.engine.model.OutlierModel;
import com.reims.anomaly.exception.ModelTrainingException;
import com.reims.anomaly.model.DetectorKind;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Local Outlier Factor (Breunig et al. 2000). Compares the local reachability
 * density of a point with that of its k nearest training neighbours: about 1.0
 * for points in a cluster, well above 1.0 for points in sparse regions.
 *
 * Scoring a point that coincides with a training row leaves that row out of
 * its own neighbourhood, so training rows get their in-sample LOF.
 */
public class LocalOutlierFactor implements OutlierModel {

    private static final double MIN_REACH_DISTANCE = 1e-9;

    private double[][] points;
    private int neighbors;
    private double[] kDistances;
    private double[] densities;

    public LocalOutlierFactor() {}

    public static LocalOutlierFactor train(double[][] data, int neighbors) {
        if (data == null || data.length < 3) {
            throw new ModelTrainingException("LOF needs at least 3 rows, got " + (data == null ? 0 : data.length));
        }
        if (neighbors < 1) {
            throw new ModelTrainingException("LOF neighbours must be at least 1, got " + neighbors);
        }

        LocalOutlierFactor lof = new LocalOutlierFactor();
        int n = data.length;
        lof.points = new double[n][];
        for (int i = 0; i < n; i++) {
            lof.points[i] = data[i].clone();
        }
        lof.neighbors = Math.min(neighbors, n - 1);

        int[][] knn = new int[n][];
        lof.kDistances = new double[n];
        for (int i = 0; i < n; i++) {
            knn[i] = lof.nearest(lof.points[i], i);
            lof.kDistances[i] = distance(lof.points[i], lof.points[knn[i][knn[i].length - 1]]);
        }

        lof.densities = new double[n];
        for (int i = 0; i < n; i++) {
            lof.densities[i] = lof.reachabilityDensity(lof.points[i], knn[i]);
        }
        return lof;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOCAL_OUTLIER_FACTOR;
    }

    @Override
    public double score(double[] point) {
        int[] knn = nearest(point, indexOf(point));
        double density = reachabilityDensity(point, knn);

        double neighbourDensity = 0.0;
        for (int j : knn) {
            neighbourDensity += densities[j];
        }
        neighbourDensity /= knn.length;

        return neighbourDensity / density;
    }

    private double reachabilityDensity(double[] point, int[] knn) {
        double sum = 0.0;
        for (int j : knn) {
            sum += Math.max(kDistances[j], distance(point, points[j]));
        }
        // duplicates have zero reach distance; bound the density so ratios stay finite
        double mean = Math.max(sum / knn.length, MIN_REACH_DISTANCE);
        return 1.0 / mean;
    }

    private int[] nearest(double[] point, int exclude) {
        return IntStream.range(0, points.length)
                .filter(j -> j != exclude)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer j) -> distance(point, points[j])).thenComparingInt(j -> j))
                .limit(neighbors)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private int indexOf(double[] point) {
        for (int i = 0; i < points.length; i++) {
            if (Arrays.equals(points[i], point)) return i;
        }
        return -1;
    }

    static double distance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public double[][] getPoints() { return points; }
    public void setPoints(double[][] points) { this.points = points; }
    public int getNeighbors() { return neighbors; }
    public void setNeighbors(int neighbors) { this.neighbors = neighbors; }
    public double[] getKDistances() { return kDistances; }
    public void setKDistances(double[] kDistances) { this.kDistances = kDistances; }
    public double[] getDensities() { return densities; }
    public void setDensities(double[] densities) { this.densities = densities; }
}
