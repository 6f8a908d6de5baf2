package com.evcharge.anomaly.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merged per-session anomaly record built during one aggregation run.
 *
 * Labels and evidence are append-only: each contributing detector adds its label once and
 * extends the details text. After {@link #freeze()} the finding rejects further changes.
 */
public final class Finding {

    public static final String TYPE_SEPARATOR = "+";
    public static final String DETAILS_SEPARATOR = "; ";

    private final String sessionId;
    private final LocalDateTime timestamp;
    private final List<AnomalyType> anomalyTypes = new ArrayList<>();
    private final StringBuilder details = new StringBuilder();
    private boolean frozen;

    private Finding(String sessionId, LocalDateTime timestamp) {
        this.sessionId = sessionId;
        this.timestamp = timestamp;
    }

    /**
     * Start a finding from the first detector that flags the session.
     */
    public static Finding open(String sessionId, LocalDateTime timestamp, AnomalyType type, String evidence) {
        Finding finding = new Finding(sessionId, timestamp);
        finding.anomalyTypes.add(type);
        finding.details.append(evidence);
        return finding;
    }

    /**
     * Add a later detector's label and a prefixed evidence segment.
     *
     * @return false if this detector's label was already present (nothing is appended)
     */
    public boolean append(AnomalyType type, String evidencePrefix, String evidence) {
        if (frozen) {
            throw new IllegalStateException("Finding for session " + sessionId + " is already finalized");
        }
        if (anomalyTypes.contains(type)) {
            return false;
        }
        anomalyTypes.add(type);
        details.append(DETAILS_SEPARATOR).append(evidencePrefix).append(": ").append(evidence);
        return true;
    }

    public void freeze() {
        this.frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public String getSessionId() {
        return sessionId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public List<AnomalyType> getAnomalyTypes() {
        return Collections.unmodifiableList(anomalyTypes);
    }

    public boolean hasAnomalyType(AnomalyType type) {
        return anomalyTypes.contains(type);
    }

    /**
     * Combined label, e.g. "dos_attack+billing_fraud".
     */
    public String getAnomalyType() {
        return anomalyTypes.stream()
                .map(AnomalyType::getLabel)
                .collect(Collectors.joining(TYPE_SEPARATOR));
    }

    public String getDetails() {
        return details.toString();
    }

    @Override
    public String toString() {
        return "Finding{sessionId=" + sessionId + ", anomalyType=" + getAnomalyType() + "}";
    }
}
