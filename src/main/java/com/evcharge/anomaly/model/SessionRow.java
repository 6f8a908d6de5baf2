package com.evcharge.anomaly.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One uploaded charging session. Cells are kept as raw text; detectors coerce what they need.
 * The position is the row's index in the uploaded file and survives any detector-local filtering.
 */
public final class SessionRow {

    private static final String NOT_AVAILABLE = "N/A";

    private final int position;
    private final Map<String, String> values;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;

    public SessionRow(int position, Map<String, String> values) {
        this(position, values, null, null);
    }

    private SessionRow(int position, Map<String, String> values, LocalDateTime startTime, LocalDateTime endTime) {
        this.position = position;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.startTime = startTime;
        this.endTime = endTime;
    }

    /**
     * Copy of this row with start/end parsed from the canonical time columns.
     * Unparsable cells become null.
     */
    public SessionRow withParsedTimes() {
        return new SessionRow(position, values,
                SessionTimestamps.parse(get(CanonicalColumns.START_TIME)),
                SessionTimestamps.parse(get(CanonicalColumns.END_TIME)));
    }

    public int getPosition() {
        return position;
    }

    public Map<String, String> getValues() {
        return values;
    }

    public String get(String column) {
        return values.get(column);
    }

    public String getSessionId() {
        String id = get(CanonicalColumns.SESSION_ID);
        return id == null ? null : id.trim();
    }

    public String getUserId() {
        String id = get(CanonicalColumns.USER_ID);
        return id == null ? null : id.trim();
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    /**
     * @return the cell as a finite double, or null if it is absent, blank, non-numeric, NaN or infinite
     */
    public Double getNumeric(String column) {
        String raw = get(column);
        if (raw == null || raw.isBlank()) return null;
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Trimmed cell text for evidence strings; "N/A" when the cell is missing.
     */
    public String display(String column) {
        String raw = get(column);
        return (raw == null || raw.isBlank()) ? NOT_AVAILABLE : raw.trim();
    }

    @Override
    public String toString() {
        return "SessionRow{position=" + position + ", sessionId=" + getSessionId() + "}";
    }
}
