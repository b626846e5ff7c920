package com.reims.anomaly.engine.scoring;

import com.reims.anomaly.engine.model.OutlierModel;
import org.springframework.stereotype.Component;

import java.util.stream.IntStream;

/**
 * Scores points concurrently on the common ForkJoin pool. Each score is computed
 * independently, so the output matches the sequential backend exactly.
 */
@Component
public class ParallelScoringBackend implements ScoringBackend {

    @Override
    public String name() {
        return "parallel";
    }

    @Override
    public double[] scoreAll(OutlierModel model, double[][] points) {
        double[] scores = new double[points.length];
        IntStream.range(0, points.length)
                .parallel()
                .forEach(i -> scores[i] = model.score(points[i]));
        return scores;
    }
}
