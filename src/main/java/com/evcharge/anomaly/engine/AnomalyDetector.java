package com.evcharge.anomaly.engine;

import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.model.SessionDataset;

import java.util.Set;

/**
 * A single detection pass over a session dataset.
 * Each implementation produces one AnomalyType; the engine runs them in AnomalyType order.
 */
public interface AnomalyDetector {

    /**
     * The label this detector attaches to flagged sessions.
     */
    AnomalyType getAnomalyType();

    /**
     * Human-readable name used in diagnostics, e.g. "DoS".
     */
    String getName();

    /**
     * Prefix written before this detector's evidence when it extends an existing finding.
     */
    String getEvidencePrefix();

    /**
     * Columns that must be present for this detector to run. The engine checks these
     * before calling {@link #detect}; absent columns skip the detector with a diagnostic.
     */
    Set<String> requiredColumns();

    /**
     * Scan the dataset. Expected failures (no usable rows, scorer errors) are reported
     * through {@link DetectionOutcome#failure}, not thrown.
     *
     * @param dataset rows with start/end times already parsed
     */
    DetectionOutcome detect(SessionDataset dataset);
}
