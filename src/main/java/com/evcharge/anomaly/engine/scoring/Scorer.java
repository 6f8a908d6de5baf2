package com.evcharge.anomaly.engine.scoring;

/**
 * Inference-only contract of a pre-fit outlier model: a fitted scaling transform followed
 * by a binary classifier. Implementations are immutable and safe to share between requests.
 */
public interface Scorer {

    /**
     * Artifact identity, e.g. "dos".
     */
    String getId();

    String getVersion();

    /**
     * Apply the fitted scaling transform. Each row must have exactly as many values as the model was fitted on.
     */
    double[][] scale(double[][] features);

    /**
     * Label each scaled row as normal or outlier. The result has one entry per input row.
     */
    OutlierLabel[] classify(double[][] scaled);
}
