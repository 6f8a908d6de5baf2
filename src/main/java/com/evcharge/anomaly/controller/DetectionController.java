package com.evcharge.anomaly.controller;

import com.aerospike.client.AerospikeException;
import com.evcharge.anomaly.config.DetectionProperties;
import com.evcharge.anomaly.engine.DatasetValidationException;
import com.evcharge.anomaly.model.AnomalyLogResponse;
import com.evcharge.anomaly.model.DetectionResponse;
import com.evcharge.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Upload charging session logs for anomaly detection and browse past findings")
public class DetectionController {

    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final AnomalyDetectionService detectionService;
    private final DetectionProperties properties;

    public DetectionController(AnomalyDetectionService detectionService, DetectionProperties properties) {
        this.detectionService = detectionService;
        this.properties = properties;
    }

    @Operation(summary = "Detect anomalies in a session CSV",
            description = "Standardizes column names, runs the DoS, billing fraud and multi-user conflict detectors " +
                    "over every session, and returns one merged finding per flagged session. Detectors whose " +
                    "columns are missing are skipped and reported in `info`. Findings are appended to the anomaly log.")
    @ApiResponse(responseCode = "200", description = "Detection finished",
            content = @Content(schema = @Schema(implementation = DetectionResponse.class)))
    @ApiResponse(responseCode = "400", description = "Not a CSV file, unreadable CSV, or essential columns missing")
    @ApiResponse(responseCode = "500", description = "Unexpected failure while processing the upload")
    @PostMapping(value = "/predict", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> predict(
            @Parameter(description = "CSV file of charging sessions with a header row")
            @RequestParam("file") MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.endsWith(".csv")) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Invalid file type. Please upload a CSV."));
        }

        try (InputStream content = file.getInputStream()) {
            DetectionResponse response = detectionService.detect(filename, content);
            return ResponseEntity.ok(response);
        } catch (DatasetValidationException e) {
            log.warn("Rejected {}: {}", filename, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.error("Could not read upload {}", filename, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Could not read uploaded file: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Detection failed for {}", filename, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "An unexpected error occurred: " + e.getMessage()));
        }
    }

    @Operation(summary = "List logged anomalies",
            description = "Returns findings from past uploads, most recent first. When the log store is unavailable " +
                    "the list is empty and `info` explains why.")
    @ApiResponse(responseCode = "200", description = "Logged findings",
            content = @Content(schema = @Schema(implementation = AnomalyLogResponse.class)))
    @ApiResponse(responseCode = "500", description = "The log store could not be read")
    @GetMapping("/logs")
    public ResponseEntity<?> getLogs(
            @Parameter(description = "Maximum number of entries to return (default 500)", example = "100")
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit == null ? properties.getLogQueryLimit() : limit;
        if (effectiveLimit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }

        try {
            AnomalyLogResponse response = detectionService.getLogs(effectiveLimit);
            return ResponseEntity.ok(response);
        } catch (AerospikeException e) {
            log.error("Failed to read the anomaly log", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to retrieve logs: " + e.getMessage()));
        }
    }
}
