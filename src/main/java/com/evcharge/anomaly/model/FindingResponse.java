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
@Schema(description = "A flagged charging session with the labels and evidence of every detector that flagged it")
public class FindingResponse {

    @JsonProperty("session_id")
    @Schema(description = "Session identifier", example = "3f1c2a9e-5b7d-4c1e-9a0b-2d6f8e4c7a11")
    private String sessionId;

    @JsonProperty("anomaly_type")
    @Schema(description = "Anomaly labels joined with '+', in detector execution order",
            example = "dos_attack+billing_fraud")
    private String anomalyType;

    @Schema(description = "Session start time (ISO-8601) or 'Invalid/Missing Timestamp'",
            example = "2024-03-01T10:15:00")
    private String timestamp;

    @Schema(description = "Evidence text, one segment per contributing detector",
            example = "CPU: 97.4%, Packets: 4120/sec; Fraud: Energy: 42.1 kWh, Amount: 0.0 INR")
    private String details;
}
