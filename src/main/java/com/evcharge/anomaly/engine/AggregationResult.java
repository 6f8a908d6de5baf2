package com.evcharge.anomaly.engine;

import com.evcharge.anomaly.model.Finding;

import java.util.List;

/**
 * Finalized findings in creation order, plus diagnostics for skipped or failed detectors.
 */
public record AggregationResult(List<Finding> findings, List<String> diagnostics) {

    public AggregationResult {
        findings = List.copyOf(findings);
        diagnostics = List.copyOf(diagnostics);
    }
}
