package com.evcharge.anomaly.engine.detectors;

import com.evcharge.anomaly.engine.AnomalyDetector;
import com.evcharge.anomaly.engine.DetectedSession;
import com.evcharge.anomaly.engine.DetectionOutcome;
import com.evcharge.anomaly.engine.scoring.OutlierLabel;
import com.evcharge.anomaly.engine.scoring.Scorer;
import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.model.SessionDataset;
import com.evcharge.anomaly.model.SessionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Feeds a fixed, ordered set of numeric feature columns through a pre-fit scorer and flags the
 * rows it classifies as outliers.
 *
 * Rows with any missing or non-numeric feature are left out of this detector only. Scorer
 * results are mapped back to the original rows by position, so dropped rows never shift them.
 *
 * One class serves both the infrastructure-abuse (CPU, packet rate) and billing-fraud
 * (energy, amount) detectors; see DetectorConfig.
 */
public class OutlierScoringDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(OutlierScoringDetector.class);

    private final String name;
    private final AnomalyType anomalyType;
    private final String evidencePrefix;
    private final List<String> featureColumns;
    private final Set<String> requiredColumns;
    private final String evidenceTemplate;
    private final Scorer scorer;

    /**
     * @param evidenceTemplate String.format pattern taking the raw feature cells in feature order,
     *                         e.g. "CPU: %s%%, Packets: %s/sec"
     */
    public OutlierScoringDetector(String name, AnomalyType anomalyType, String evidencePrefix,
                                  List<String> featureColumns, String evidenceTemplate, Scorer scorer) {
        if (featureColumns == null || featureColumns.isEmpty()) {
            throw new IllegalArgumentException(name + " detector needs at least one feature column");
        }
        this.name = name;
        this.anomalyType = anomalyType;
        this.evidencePrefix = evidencePrefix;
        this.featureColumns = List.copyOf(featureColumns);
        this.requiredColumns = Collections.unmodifiableSet(new LinkedHashSet<>(featureColumns));
        this.evidenceTemplate = evidenceTemplate;
        this.scorer = scorer;
    }

    @Override
    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getEvidencePrefix() {
        return evidencePrefix;
    }

    @Override
    public Set<String> requiredColumns() {
        return requiredColumns;
    }

    public Scorer getScorer() {
        return scorer;
    }

    @Override
    public DetectionOutcome detect(SessionDataset dataset) {
        List<SessionRow> scoredRows = new ArrayList<>();
        List<double[]> matrix = new ArrayList<>();

        for (SessionRow row : dataset.getRows()) {
            double[] vector = featureVector(row);
            if (vector != null) {
                scoredRows.add(row);
                matrix.add(vector);
            }
        }

        if (scoredRows.isEmpty()) {
            return DetectionOutcome.failure(String.format(
                    "Skipping %s detection: no rows with valid numeric values for %s", name, featureColumns));
        }
        log.debug("{} detection: scoring {} of {} rows with scorer {} v{}",
                name, scoredRows.size(), dataset.size(), scorer.getId(), scorer.getVersion());

        OutlierLabel[] labels;
        try {
            double[][] scaled = scorer.scale(matrix.toArray(new double[0][]));
            labels = scorer.classify(scaled);
        } catch (RuntimeException e) {
            log.error("Scorer {} failed during {} detection: {}", scorer.getId(), name, e.getMessage(), e);
            return DetectionOutcome.failure(String.format("%s detection failed: %s", name, e.getMessage()));
        }

        if (labels == null || labels.length != scoredRows.size()) {
            return DetectionOutcome.failure(String.format(
                    "%s detection failed: scorer returned %d labels for %d rows",
                    name, labels == null ? 0 : labels.length, scoredRows.size()));
        }

        List<DetectedSession> detections = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == OutlierLabel.OUTLIER) {
                SessionRow row = scoredRows.get(i);
                detections.add(new DetectedSession(row, evidence(row)));
            }
        }

        log.info("{} model predicted {} anomalies", name, detections.size());
        return DetectionOutcome.success(detections);
    }

    private double[] featureVector(SessionRow row) {
        double[] vector = new double[featureColumns.size()];
        for (int f = 0; f < vector.length; f++) {
            Double value = row.getNumeric(featureColumns.get(f));
            if (value == null) {
                return null;
            }
            vector[f] = value;
        }
        return vector;
    }

    private String evidence(SessionRow row) {
        Object[] cells = new Object[featureColumns.size()];
        for (int f = 0; f < cells.length; f++) {
            cells[f] = row.display(featureColumns.get(f));
        }
        return String.format(evidenceTemplate, cells);
    }
}
