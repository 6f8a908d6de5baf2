package com.evcharge.anomaly.engine.scoring;

import com.evcharge.anomaly.engine.isolationforest.IsolationForest;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flags a point whose isolation forest score exceeds {@code threshold}.
 * 0.6 is a reasonable cut-off; 0.5 means "indistinguishable from the fitted data".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForestClassifier implements OutlierClassifier {

    private IsolationForest forest;

    private double threshold = 0.6;

    @Override
    public OutlierLabel classify(double[] scaledPoint) {
        return forest.score(scaledPoint) > threshold ? OutlierLabel.OUTLIER : OutlierLabel.NORMAL;
    }

    @Override
    public void validate(int featureCount) {
        if (forest == null || forest.getTrees() == null || forest.getTrees().isEmpty()) {
            throw new IllegalArgumentException("isolation_forest classifier has no trees");
        }
        if (forest.maxFeatureIndex() >= featureCount) {
            throw new IllegalArgumentException(String.format(
                    "isolation_forest splits on feature %d but the scaler has only %d features",
                    forest.maxFeatureIndex(), featureCount));
        }
        if (threshold <= 0 || threshold >= 1) {
            throw new IllegalArgumentException("isolation_forest threshold must be in (0, 1), got " + threshold);
        }
    }
}
