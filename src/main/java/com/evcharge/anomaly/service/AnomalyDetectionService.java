package com.evcharge.anomaly.service;

import com.aerospike.client.AerospikeException;
import com.evcharge.anomaly.config.MetricsConfig;
import com.evcharge.anomaly.engine.AggregationEngine;
import com.evcharge.anomaly.engine.AggregationResult;
import com.evcharge.anomaly.model.AnomalyLogEntry;
import com.evcharge.anomaly.model.AnomalyLogResponse;
import com.evcharge.anomaly.model.DetectionResponse;
import com.evcharge.anomaly.model.FindingResponse;
import com.evcharge.anomaly.model.SessionDataset;
import com.evcharge.anomaly.model.SessionTimestamps;
import com.evcharge.anomaly.repository.AnomalyLogRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String DATABASE_NOT_CONNECTED = "Database not connected.";

    private final SessionCsvReader csvReader;
    private final ColumnNameStandardizer standardizer;
    private final AggregationEngine aggregationEngine;
    private final ResultFormatter resultFormatter;
    private final AnomalyLogRepository logRepository;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(SessionCsvReader csvReader,
                                   ColumnNameStandardizer standardizer,
                                   AggregationEngine aggregationEngine,
                                   ResultFormatter resultFormatter,
                                   AnomalyLogRepository logRepository,
                                   MetricsConfig metricsConfig) {
        this.csvReader = csvReader;
        this.standardizer = standardizer;
        this.aggregationEngine = aggregationEngine;
        this.resultFormatter = resultFormatter;
        this.logRepository = logRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run every detector over an uploaded session file and append the findings to the anomaly log.
     * This is the main entry point called by the REST controller.
     *
     * @throws com.evcharge.anomaly.engine.DatasetValidationException if the file is unreadable
     *         or lacks session_id, user_id, start_time or end_time
     */
    @Observed(name = "detection.predict", contextualName = "detect-upload")
    public DetectionResponse detect(String filename, InputStream content) {
        // 1. Parse and map headers onto the canonical schema
        SessionDataset dataset = standardizer.standardize(csvReader.read(content));
        log.info("Processing {}: {} sessions, columns {}", filename, dataset.size(), dataset.getColumns());

        // 2. Detect and merge
        AggregationResult result = aggregationEngine.aggregate(dataset);
        ResultFormatter.DetectionReport report = resultFormatter.format(result);

        // 3. Append to the anomaly log; failures here never fail the upload
        if (!report.anomalies().isEmpty()) {
            storeFindings(report.anomalies());
        }

        metricsConfig.recordUpload(dataset.size(), report.anomalies().size());
        log.info("Finished {}: {} anomalies in {} sessions, {} diagnostics",
                filename, report.anomalies().size(), dataset.size(), report.info().size());

        return DetectionResponse.builder()
                .filename(filename)
                .totalSessions(dataset.size())
                .anomaliesFound(report.anomalies().size())
                .anomalies(report.anomalies())
                .info(report.info())
                .build();
    }

    public AnomalyLogResponse getLogs(int limit) {
        if (!logRepository.isConnected()) {
            log.warn("Anomaly log requested but the log store is not connected");
            return new AnomalyLogResponse(List.of(), DATABASE_NOT_CONNECTED);
        }
        List<AnomalyLogEntry> entries = logRepository.findRecent(limit);
        log.debug("Returning {} anomaly log entries (limit {})", entries.size(), limit);
        return AnomalyLogResponse.of(entries);
    }

    private void storeFindings(List<FindingResponse> findings) {
        if (!logRepository.isConnected()) {
            log.warn("Log store not connected; {} findings were not recorded", findings.size());
            metricsConfig.recordLogWrite("skipped", findings.size());
            return;
        }

        // One detection timestamp per upload
        long detectedAtMs = System.currentTimeMillis();
        String detectedAt = SessionTimestamps.format(
                LocalDateTime.ofInstant(Instant.ofEpochMilli(detectedAtMs), ZoneId.systemDefault()));

        List<AnomalyLogEntry> entries = new ArrayList<>(findings.size());
        for (FindingResponse finding : findings) {
            entries.add(AnomalyLogEntry.from(finding, detectedAt, detectedAtMs));
        }

        try {
            int written = logRepository.saveAll(entries);
            metricsConfig.recordLogWrite("success", written);
            log.info("Recorded {} findings in the anomaly log", written);
        } catch (AerospikeException e) {
            log.error("Failed to record findings in the anomaly log: {}", e.getMessage(), e);
            metricsConfig.recordLogWrite("failed", entries.size());
        }
    }
}
