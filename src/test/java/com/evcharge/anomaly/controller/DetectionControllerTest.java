package com.evcharge.anomaly.controller;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.evcharge.anomaly.config.DetectionProperties;
import com.evcharge.anomaly.engine.DatasetValidationException;
import com.evcharge.anomaly.model.AnomalyLogEntry;
import com.evcharge.anomaly.model.AnomalyLogResponse;
import com.evcharge.anomaly.model.DetectionResponse;
import com.evcharge.anomaly.model.FindingResponse;
import com.evcharge.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectionController.class)
@Import(DetectionProperties.class)
class DetectionControllerTest {

    private static final byte[] CSV = ("session_id,user_id,start_time,end_time\n"
            + "S1,U1,2024-03-01 10:00:00,2024-03-01 10:30:00\n").getBytes(StandardCharsets.UTF_8);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    @Test
    void predict_success() throws Exception {
        DetectionResponse response = DetectionResponse.builder()
                .filename("sessions.csv")
                .totalSessions(1)
                .anomaliesFound(1)
                .anomalies(List.of(FindingResponse.builder()
                        .sessionId("S1")
                        .anomalyType("dos_attack+billing_fraud")
                        .timestamp("2024-03-01T10:00:00")
                        .details("CPU: 98%, Packets: 4000/sec; Fraud: Energy: 40 kWh, Amount: 0 INR")
                        .build()))
                .info(List.of())
                .build();
        when(detectionService.detect(eq("sessions.csv"), any(InputStream.class))).thenReturn(response);

        mockMvc.perform(multipart("/api/v1/detections/predict")
                        .file(new MockMultipartFile("file", "sessions.csv", "text/csv", CSV)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("sessions.csv"))
                .andExpect(jsonPath("$.total_sessions").value(1))
                .andExpect(jsonPath("$.anomalies_found").value(1))
                .andExpect(jsonPath("$.anomalies[0].session_id").value("S1"))
                .andExpect(jsonPath("$.anomalies[0].anomaly_type").value("dos_attack+billing_fraud"))
                .andExpect(jsonPath("$.info").isArray());
    }

    @Test
    void predict_notCsv_badRequest() throws Exception {
        mockMvc.perform(multipart("/api/v1/detections/predict")
                        .file(new MockMultipartFile("file", "sessions.xlsx", "application/octet-stream", CSV)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid file type. Please upload a CSV."));

        verify(detectionService, never()).detect(anyString(), any(InputStream.class));
    }

    @Test
    void predict_missingEssentialColumns_badRequest() throws Exception {
        when(detectionService.detect(anyString(), any(InputStream.class)))
                .thenThrow(new DatasetValidationException("Missing essential columns: [session_id]"));

        mockMvc.perform(multipart("/api/v1/detections/predict")
                        .file(new MockMultipartFile("file", "sessions.csv", "text/csv", CSV)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing essential columns: [session_id]"));
    }

    @Test
    void predict_unexpectedFailure_serverErrorWithMessage() throws Exception {
        when(detectionService.detect(anyString(), any(InputStream.class)))
                .thenThrow(new IllegalStateException("scorer state corrupted"));

        mockMvc.perform(multipart("/api/v1/detections/predict")
                        .file(new MockMultipartFile("file", "sessions.csv", "text/csv", CSV)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("An unexpected error occurred: scorer state corrupted"));
    }

    @Test
    void getLogs_defaultLimit() throws Exception {
        AnomalyLogEntry entry = AnomalyLogEntry.builder()
                .sessionId("S1")
                .anomalyType("billing_fraud")
                .timestamp("2024-03-01T10:00:00")
                .details("Energy: 40 kWh, Amount: 0 INR")
                .detectionTimestamp("2024-03-02T08:00:00")
                .detectedAtMs(1709366400000L)
                .build();
        when(detectionService.getLogs(500)).thenReturn(AnomalyLogResponse.of(List.of(entry)));

        mockMvc.perform(get("/api/v1/detections/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalies[0].session_id").value("S1"))
                .andExpect(jsonPath("$.anomalies[0].detection_timestamp").value("2024-03-02T08:00:00"))
                .andExpect(jsonPath("$.anomalies[0].detectedAtMs").doesNotExist())
                .andExpect(jsonPath("$.info").doesNotExist());
    }

    @Test
    void getLogs_storeDown_infoMessage() throws Exception {
        when(detectionService.getLogs(25)).thenReturn(new AnomalyLogResponse(List.of(), "Database not connected."));

        mockMvc.perform(get("/api/v1/detections/logs").param("limit", "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalies").isEmpty())
                .andExpect(jsonPath("$.info").value("Database not connected."));
    }

    @Test
    void getLogs_nonPositiveLimit_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/detections/logs").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("limit must be positive"));
    }

    @Test
    void getLogs_readFails_serverError() throws Exception {
        when(detectionService.getLogs(anyInt())).thenThrow(new AerospikeException(ResultCode.TIMEOUT));

        mockMvc.perform(get("/api/v1/detections/logs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(startsWith("Failed to retrieve logs")));
    }
}
