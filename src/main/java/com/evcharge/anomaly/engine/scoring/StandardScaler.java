package com.evcharge.anomaly.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fitted per-feature standardisation: z = (x - mean) / scale.
 * A zero scale (constant feature at fit time) is treated as 1.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StandardScaler {

    private double[] mean;
    private double[] scale;

    public int featureCount() {
        return mean == null ? 0 : mean.length;
    }

    public double[][] transform(double[][] features) {
        double[][] scaled = new double[features.length][];
        for (int r = 0; r < features.length; r++) {
            double[] row = features[r];
            if (row.length != mean.length) {
                throw new IllegalArgumentException(String.format(
                        "Scaler expects %d features but row %d has %d", mean.length, r, row.length));
            }
            double[] out = new double[row.length];
            for (int f = 0; f < row.length; f++) {
                double s = scale[f] == 0.0 ? 1.0 : scale[f];
                out[f] = (row[f] - mean[f]) / s;
            }
            scaled[r] = out;
        }
        return scaled;
    }

    void validate() {
        if (mean == null || scale == null || mean.length == 0) {
            throw new IllegalArgumentException("Scaler must define mean and scale");
        }
        if (mean.length != scale.length) {
            throw new IllegalArgumentException(String.format(
                    "Scaler mean has %d entries but scale has %d", mean.length, scale.length));
        }
    }
}
