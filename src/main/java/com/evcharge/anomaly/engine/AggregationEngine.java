package com.evcharge.anomaly.engine;

import com.evcharge.anomaly.config.MetricsConfig;
import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.model.CanonicalColumns;
import com.evcharge.anomaly.model.Finding;
import com.evcharge.anomaly.model.SessionDataset;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered detector over one dataset and merges their flags into
 * one Finding per session.
 *
 * Detectors are keyed by AnomalyType and run sequentially in enum order
 * (DoS, billing fraud, multi-user conflict), so labels and evidence of a merged
 * finding always appear in that order. Only missing identity/time columns abort a run;
 * anything a single detector cannot do ends up in the diagnostics list.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final Map<AnomalyType, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AggregationEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(AnomalyType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : detectors) {
            AnomalyDetector previous = detectorMap.putIfAbsent(detector.getAnomalyType(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.getAnomalyType()
                        + ": " + previous.getName() + " and " + detector.getName());
            }
            log.info("Registered detector: {} -> {} (requires {})",
                    detector.getAnomalyType(), detector.getName(), detector.requiredColumns());
        }
    }

    /**
     * Detect and merge anomalies for one dataset.
     *
     * @throws DatasetValidationException if session_id, start_time, end_time or user_id is missing
     */
    @Observed(name = "detection.aggregate", contextualName = "aggregate-detectors")
    public AggregationResult aggregate(SessionDataset dataset) {
        List<String> missing = dataset.missingColumns(CanonicalColumns.ESSENTIAL);
        if (!missing.isEmpty()) {
            String msg = "Essential columns missing: " + missing + ". Cannot proceed.";
            log.error(msg);
            throw new DatasetValidationException(msg, missing);
        }

        SessionDataset parsed = dataset.withParsedTimes();
        Map<String, Finding> findings = new LinkedHashMap<>();
        List<String> diagnostics = new ArrayList<>();

        for (AnomalyDetector detector : detectorMap.values()) {
            String typeLabel = detector.getAnomalyType().getLabel();

            if (!parsed.missingColumns(detector.requiredColumns()).isEmpty()) {
                String msg = String.format("Skipping %s detection: Missing one or more required columns (%s)",
                        detector.getName(), detector.requiredColumns());
                log.warn(msg);
                diagnostics.add(msg);
                metricsConfig.recordDetectorRun(typeLabel, "skipped");
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("detector." + typeLabel)
                    .tag("detector.name", detector.getName())
                    .tag("dataset.rows", String.valueOf(parsed.size()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                log.info("Running {} detection over {} sessions", detector.getName(), parsed.size());
                DetectionOutcome outcome = detector.detect(parsed);

                if (!outcome.isSuccess()) {
                    log.warn("{} detection produced no result: {}", detector.getName(), outcome.failureReason());
                    diagnostics.add(outcome.failureReason());
                    span.tag("detector.outcome", "failed");
                    metricsConfig.recordDetectorRun(typeLabel, "failed");
                    continue;
                }

                int merged = merge(findings, detector, outcome.detections());
                log.info("{} detection flagged {} rows ({} merged into existing findings)",
                        detector.getName(), outcome.detections().size(), merged);

                span.tag("detector.outcome", "success");
                span.tag("detector.flagged", String.valueOf(outcome.detections().size()));
                metricsConfig.recordDetectorRun(typeLabel, outcome.detections().isEmpty() ? "clean" : "flagged");
                metricsConfig.recordFlaggedSessions(typeLabel, outcome.detections().size());
            } catch (RuntimeException e) {
                // One broken detector never blocks the others
                span.error(e);
                String msg = String.format("%s detection failed: %s", detector.getName(), e.getMessage());
                log.error("Error during {} detection: {}", detector.getName(), e.getMessage(), e);
                diagnostics.add(msg);
                metricsConfig.recordDetectorRun(typeLabel, "failed");
            } finally {
                span.end();
            }
        }

        findings.values().forEach(Finding::freeze);
        log.info("Aggregation finished: {} findings, {} diagnostics", findings.size(), diagnostics.size());
        return new AggregationResult(new ArrayList<>(findings.values()), diagnostics);
    }

    /**
     * @return how many detections extended an existing finding
     */
    private int merge(Map<String, Finding> findings, AnomalyDetector detector, List<DetectedSession> detections) {
        int extended = 0;
        for (DetectedSession detection : detections) {
            String sessionId = detection.sessionId();
            if (sessionId == null || sessionId.isEmpty()) {
                log.warn("{} flagged row {} without a session_id; ignoring it",
                        detector.getName(), detection.row().getPosition());
                continue;
            }

            Finding existing = findings.get(sessionId);
            if (existing == null) {
                findings.put(sessionId, Finding.open(sessionId, detection.row().getStartTime(),
                        detector.getAnomalyType(), detection.evidence()));
            } else if (existing.append(detector.getAnomalyType(), detector.getEvidencePrefix(), detection.evidence())) {
                extended++;
            }
        }
        return extended;
    }
}
