package com.evcharge.anomaly.engine.scoring;

/**
 * Stands in for a scorer whose artifact could not be loaded at start-up.
 * Every call fails, so the owning detector reports a diagnostic on each run while the
 * other detectors keep working.
 */
public final class UnavailableScorer implements Scorer {

    private final String id;
    private final String reason;

    public UnavailableScorer(String id, String reason) {
        this.id = id;
        this.reason = reason;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getVersion() {
        return "unavailable";
    }

    @Override
    public double[][] scale(double[][] features) {
        throw new IllegalStateException("Scorer '" + id + "' is not loaded: " + reason);
    }

    @Override
    public OutlierLabel[] classify(double[][] scaled) {
        throw new IllegalStateException("Scorer '" + id + "' is not loaded: " + reason);
    }
}
