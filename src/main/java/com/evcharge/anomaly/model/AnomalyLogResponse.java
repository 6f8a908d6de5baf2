package com.evcharge.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Historical findings, newest upload first")
public record AnomalyLogResponse(List<AnomalyLogEntry> anomalies, String info) {

    public static AnomalyLogResponse of(List<AnomalyLogEntry> anomalies) {
        return new AnomalyLogResponse(anomalies, null);
    }
}
