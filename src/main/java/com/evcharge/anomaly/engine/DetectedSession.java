package com.evcharge.anomaly.engine;

import com.evcharge.anomaly.model.SessionRow;

/**
 * A row flagged by a detector, with that detector's evidence text.
 */
public record DetectedSession(SessionRow row, String evidence) {

    public String sessionId() {
        return row.getSessionId();
    }
}
