package com.evcharge.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A finding as stored in the anomaly log")
public class AnomalyLogEntry {

    @JsonProperty("session_id")
    @Schema(description = "Session identifier")
    private String sessionId;

    @JsonProperty("anomaly_type")
    @Schema(description = "Anomaly labels joined with '+'", example = "billing_fraud")
    private String anomalyType;

    @Schema(description = "Session start time (ISO-8601) or 'Invalid/Missing Timestamp'")
    private String timestamp;

    @Schema(description = "Evidence text")
    private String details;

    @JsonProperty("detection_timestamp")
    @Schema(description = "When the upload containing this finding was processed (ISO-8601)",
            example = "2024-03-02T08:00:12.345")
    private String detectionTimestamp;

    // Epoch millis of detectionTimestamp, used for ordering
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @Schema(hidden = true)
    private long detectedAtMs;

    public static AnomalyLogEntry from(FindingResponse finding, String detectionTimestamp, long detectedAtMs) {
        return AnomalyLogEntry.builder()
                .sessionId(finding.getSessionId())
                .anomalyType(finding.getAnomalyType())
                .timestamp(finding.getTimestamp())
                .details(finding.getDetails())
                .detectionTimestamp(detectionTimestamp)
                .detectedAtMs(detectedAtMs)
                .build();
    }
}
