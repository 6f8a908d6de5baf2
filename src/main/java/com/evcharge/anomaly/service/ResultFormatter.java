package com.evcharge.anomaly.service;

import com.evcharge.anomaly.config.DetectionProperties;
import com.evcharge.anomaly.engine.AggregationResult;
import com.evcharge.anomaly.model.Finding;
import com.evcharge.anomaly.model.FindingResponse;
import com.evcharge.anomaly.model.SessionTimestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns finalised findings into response rows, in creation order.
 */
@Component
public class ResultFormatter {

    private static final Logger log = LoggerFactory.getLogger(ResultFormatter.class);

    private final DetectionProperties properties;

    public ResultFormatter(DetectionProperties properties) {
        this.properties = properties;
    }

    public record DetectionReport(List<FindingResponse> anomalies, List<String> info) {
        public DetectionReport {
            anomalies = List.copyOf(anomalies);
            info = List.copyOf(info);
        }
    }

    public DetectionReport format(AggregationResult result) {
        List<FindingResponse> anomalies = new ArrayList<>(result.findings().size());
        int invalidTimestamps = 0;

        for (Finding finding : result.findings()) {
            String timestamp = SessionTimestamps.format(finding.getTimestamp());
            if (timestamp == null) {
                timestamp = properties.getInvalidTimestampText();
                invalidTimestamps++;
            }
            anomalies.add(FindingResponse.builder()
                    .sessionId(finding.getSessionId())
                    .anomalyType(finding.getAnomalyType())
                    .timestamp(timestamp)
                    .details(finding.getDetails())
                    .build());
        }

        if (invalidTimestamps > 0) {
            log.warn("{} of {} findings have a missing or unparsable start time", invalidTimestamps, anomalies.size());
        }
        return new DetectionReport(anomalies, result.diagnostics());
    }
}
