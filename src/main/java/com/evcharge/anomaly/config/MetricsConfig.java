package com.evcharge.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome one of "flagged", "clean", "skipped", "failed"
     */
    public void recordDetectorRun(String anomalyType, String outcome) {
        Counter.builder("detector.run.count")
                .tag("anomaly_type", anomalyType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordFlaggedSessions(String anomalyType, int count) {
        Counter.builder("detector.flagged.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment(count);
    }

    public void recordUpload(int totalSessions, int findings) {
        DistributionSummary.builder("upload.sessions")
                .register(registry)
                .record(totalSessions);

        DistributionSummary.builder("upload.findings")
                .register(registry)
                .record(findings);
    }

    public void recordLogWrite(String status, int count) {
        Counter.builder("anomaly_log.write.count")
                .tag("status", status)
                .register(registry)
                .increment(count);
    }
}
