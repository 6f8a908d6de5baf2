package com.evcharge.anomaly.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flags a point if any scaled feature lies more than {@code limit} standard deviations from the fitted mean.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ZScoreClassifier implements OutlierClassifier {

    private double limit = 3.0;

    @Override
    public OutlierLabel classify(double[] scaledPoint) {
        for (double z : scaledPoint) {
            if (Math.abs(z) > limit) {
                return OutlierLabel.OUTLIER;
            }
        }
        return OutlierLabel.NORMAL;
    }

    @Override
    public void validate(int featureCount) {
        if (!(limit > 0)) {
            throw new IllegalArgumentException("z_score limit must be positive, got " + limit);
        }
    }
}
