package com.evcharge.anomaly.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Robust-covariance style envelope: flags a point whose Mahalanobis distance
 * sqrt((x - location)' P (x - location)) from the fitted location exceeds {@code threshold}.
 *
 * Catches points that break the correlation between features even when every feature
 * is individually in range, e.g. a normal energy reading billed at zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MahalanobisClassifier implements OutlierClassifier {

    private double[] location;

    // Inverse covariance matrix, fitted on scaled data
    private double[][] precision;

    private double threshold;

    @Override
    public OutlierLabel classify(double[] scaledPoint) {
        return distance(scaledPoint) > threshold ? OutlierLabel.OUTLIER : OutlierLabel.NORMAL;
    }

    public double distance(double[] scaledPoint) {
        int n = location.length;
        double[] delta = new double[n];
        for (int i = 0; i < n; i++) {
            delta[i] = scaledPoint[i] - location[i];
        }
        double squared = 0.0;
        for (int i = 0; i < n; i++) {
            double rowSum = 0.0;
            for (int j = 0; j < n; j++) {
                rowSum += precision[i][j] * delta[j];
            }
            squared += delta[i] * rowSum;
        }
        return Math.sqrt(Math.max(0.0, squared));
    }

    @Override
    public void validate(int featureCount) {
        if (location == null || location.length != featureCount) {
            throw new IllegalArgumentException("mahalanobis location must have " + featureCount + " entries");
        }
        if (precision == null || precision.length != featureCount) {
            throw new IllegalArgumentException("mahalanobis precision must be " + featureCount + "x" + featureCount);
        }
        for (double[] row : precision) {
            if (row == null || row.length != featureCount) {
                throw new IllegalArgumentException("mahalanobis precision must be " + featureCount + "x" + featureCount);
            }
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("mahalanobis threshold must be positive, got " + threshold);
        }
    }
}
