package com.evcharge.anomaly.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk form of a pre-fit scorer:
 *
 * <pre>
 * {
 *   "id": "dos", "version": "1",
 *   "features": ["cpu_usage_percent", "packets_per_sec"],
 *   "scaler": {"mean": [...], "scale": [...]},
 *   "classifier": {"type": "z_score", "limit": 3.0}
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScorerArtifact {

    private String id;
    private String version;

    // Feature columns in the order the model was fitted on
    private List<String> features;

    private StandardScaler scaler;
    private OutlierClassifier classifier;
}
