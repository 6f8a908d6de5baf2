package com.evcharge.anomaly.engine.scoring;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Binary classifier applied to one already-scaled feature vector.
 * The "type" property of a scorer artifact selects the implementation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForestClassifier.class, name = "isolation_forest"),
        @JsonSubTypes.Type(value = ZScoreClassifier.class, name = "z_score"),
        @JsonSubTypes.Type(value = MahalanobisClassifier.class, name = "mahalanobis")
})
public interface OutlierClassifier {

    OutlierLabel classify(double[] scaledPoint);

    /**
     * Check the fitted parameters against the scaler's feature count.
     *
     * @throws IllegalArgumentException if the parameters are unusable
     */
    void validate(int featureCount);
}
