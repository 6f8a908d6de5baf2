package com.evcharge.anomaly.engine;

import java.util.List;

/**
 * Result of one detector pass: either the flagged sessions, or the reason the pass produced nothing.
 */
public record DetectionOutcome(List<DetectedSession> detections, String failureReason) {

    public DetectionOutcome {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public static DetectionOutcome success(List<DetectedSession> detections) {
        return new DetectionOutcome(detections, null);
    }

    public static DetectionOutcome failure(String reason) {
        return new DetectionOutcome(List.of(), reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
