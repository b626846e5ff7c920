package com.reims.anomaly.engine.scoring;

import com.reims.anomaly.engine.model.OutlierModel;
import org.springframework.stereotype.Component;

@Component
public class SequentialScoringBackend implements ScoringBackend {

    @Override
    public String name() {
        return "sequential";
    }

    @Override
    public double[] scoreAll(OutlierModel model, double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = model.score(points[i]);
        }
        return scores;
    }
}
