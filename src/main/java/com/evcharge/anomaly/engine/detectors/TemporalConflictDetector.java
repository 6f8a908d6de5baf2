package com.evcharge.anomaly.engine.detectors;

import com.evcharge.anomaly.engine.AnomalyDetector;
import com.evcharge.anomaly.engine.DetectedSession;
import com.evcharge.anomaly.engine.DetectionOutcome;
import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.model.CanonicalColumns;
import com.evcharge.anomaly.model.SessionDataset;
import com.evcharge.anomaly.model.SessionRow;
import com.evcharge.anomaly.model.SessionTimestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags sessions where the same user starts a new session before their previous one ended.
 *
 * Logic: rows with a parsed start and end time and a user id are sorted by (user_id, start_time).
 * A row conflicts when it shares the user of its immediate predecessor and starts strictly
 * before that predecessor's end. Only the later-starting row of each pair is flagged.
 *
 * Only adjacent pairs are compared. With A=[10:00,12:00], B=[10:10,10:20], C=[10:30,10:40]
 * for one user, B is flagged but C is not, although C overlaps A.
 */
@Component
public class TemporalConflictDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(TemporalConflictDetector.class);

    private static final Set<String> REQUIRED_COLUMNS = new LinkedHashSet<>(List.of(
            CanonicalColumns.USER_ID,
            CanonicalColumns.START_TIME,
            CanonicalColumns.END_TIME,
            CanonicalColumns.SESSION_ID));

    private static final Comparator<SessionRow> BY_USER_THEN_START =
            Comparator.comparing(SessionRow::getUserId).thenComparing(SessionRow::getStartTime);

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.MULTI_USER_CONFLICT;
    }

    @Override
    public String getName() {
        return "Multi-User Conflict";
    }

    @Override
    public String getEvidencePrefix() {
        return "Conflict";
    }

    @Override
    public Set<String> requiredColumns() {
        return REQUIRED_COLUMNS;
    }

    @Override
    public DetectionOutcome detect(SessionDataset dataset) {
        List<SessionRow> timed = new ArrayList<>();
        for (SessionRow row : dataset.getRows()) {
            if (row.getStartTime() != null && row.getEndTime() != null
                    && row.getUserId() != null && !row.getUserId().isEmpty()) {
                timed.add(row);
            }
        }
        log.debug("Conflict check: {} of {} rows have a user and valid start/end times",
                timed.size(), dataset.size());

        // List.sort is stable, so equal (user, start) keys keep upload order
        timed.sort(BY_USER_THEN_START);

        Set<String> conflictIds = new HashSet<>();
        for (int i = 1; i < timed.size(); i++) {
            SessionRow previous = timed.get(i - 1);
            SessionRow current = timed.get(i);
            if (current.getUserId().equals(previous.getUserId())
                    && current.getStartTime().isBefore(previous.getEndTime())) {
                conflictIds.add(current.getSessionId());
            }
        }

        List<DetectedSession> detections = new ArrayList<>();
        for (SessionRow row : dataset.getRows()) {
            if (row.getSessionId() != null && conflictIds.contains(row.getSessionId())) {
                detections.add(new DetectedSession(row, evidence(row)));
            }
        }

        log.debug("Found {} conflicting sessions ({} rows)", conflictIds.size(), detections.size());
        return DetectionOutcome.success(detections);
    }

    private String evidence(SessionRow row) {
        return String.format("User: %s, Start: %s, End: %s",
                row.display(CanonicalColumns.USER_ID),
                timeText(row.getStartTime(), row, CanonicalColumns.START_TIME),
                timeText(row.getEndTime(), row, CanonicalColumns.END_TIME));
    }

    private String timeText(LocalDateTime parsed, SessionRow row, String column) {
        return parsed != null ? SessionTimestamps.format(parsed) : row.display(column);
    }
}
