package com.evcharge.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of running all detectors over one uploaded session file")
public class DetectionResponse {

    @Schema(description = "Name of the uploaded file", example = "ev_charging_data.csv")
    private String filename;

    @JsonProperty("total_sessions")
    @Schema(description = "Number of data rows in the upload", example = "10000")
    private int totalSessions;

    @JsonProperty("anomalies_found")
    @Schema(description = "Number of distinct flagged sessions", example = "1342")
    private int anomaliesFound;

    @Schema(description = "Merged findings, one per flagged session")
    private List<FindingResponse> anomalies;

    @Schema(description = "Diagnostics for detectors that were skipped or failed",
            example = "[\"Skipping DoS detection: Missing one or more required columns ([cpu_usage_percent, packets_per_sec])\"]")
    private List<String> info;
}
