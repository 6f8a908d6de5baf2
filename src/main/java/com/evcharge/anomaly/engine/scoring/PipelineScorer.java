package com.evcharge.anomaly.engine.scoring;

import java.util.List;

/**
 * Scaler-then-classifier pipeline built from a loaded {@link ScorerArtifact}.
 */
public final class PipelineScorer implements Scorer {

    private final String id;
    private final String version;
    private final List<String> features;
    private final StandardScaler scaler;
    private final OutlierClassifier classifier;

    private PipelineScorer(ScorerArtifact artifact) {
        this.id = artifact.getId();
        this.version = artifact.getVersion();
        this.features = artifact.getFeatures() == null ? List.of() : List.copyOf(artifact.getFeatures());
        this.scaler = artifact.getScaler();
        this.classifier = artifact.getClassifier();
    }

    /**
     * @throws IllegalArgumentException if the artifact is incomplete or its parts disagree on feature count
     */
    public static PipelineScorer from(ScorerArtifact artifact) {
        if (artifact.getScaler() == null) {
            throw new IllegalArgumentException("Scorer artifact '" + artifact.getId() + "' has no scaler");
        }
        if (artifact.getClassifier() == null) {
            throw new IllegalArgumentException("Scorer artifact '" + artifact.getId() + "' has no classifier");
        }
        artifact.getScaler().validate();
        int featureCount = artifact.getScaler().featureCount();
        artifact.getClassifier().validate(featureCount);

        List<String> features = artifact.getFeatures();
        if (features != null && !features.isEmpty() && features.size() != featureCount) {
            throw new IllegalArgumentException(String.format(
                    "Scorer artifact '%s' lists %d features but its scaler was fitted on %d",
                    artifact.getId(), features.size(), featureCount));
        }
        return new PipelineScorer(artifact);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getVersion() {
        return version;
    }

    public List<String> getFeatures() {
        return features;
    }

    @Override
    public double[][] scale(double[][] rows) {
        return scaler.transform(rows);
    }

    @Override
    public OutlierLabel[] classify(double[][] scaled) {
        OutlierLabel[] labels = new OutlierLabel[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            labels[i] = classifier.classify(scaled[i]);
        }
        return labels;
    }

    @Override
    public String toString() {
        return "PipelineScorer{" + id + " v" + version + ", features=" + features + "}";
    }
}
