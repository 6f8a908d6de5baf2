package com.evcharge.anomaly.config;

import com.evcharge.anomaly.model.CanonicalColumns;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    // Shown in place of a start time that is absent or could not be parsed
    private String invalidTimestampText = "Invalid/Missing Timestamp";

    // Default page size for GET /logs
    private int logQueryLimit = 500;

    // Browser origins allowed to call the API (dashboard dev servers by default)
    private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:5173",
            "http://localhost:5174",
            "http://localhost:3000",
            "http://127.0.0.1:5173",
            "http://127.0.0.1:5174",
            "http://127.0.0.1:3000"));

    // Infrastructure abuse (CPU + packet rate)
    private ScorerSettings dos = new ScorerSettings(
            "classpath:models/dos_scorer.json",
            List.of(CanonicalColumns.CPU_USAGE_PERCENT, CanonicalColumns.PACKETS_PER_SEC));

    // Billing fraud (energy + amount)
    private ScorerSettings fraud = new ScorerSettings(
            "classpath:models/fraud_scorer.json",
            List.of(CanonicalColumns.ENERGY_KWH, CanonicalColumns.AMOUNT_INR));

    @Data
    public static class ScorerSettings {
        // Spring resource location; "file:/path/model.json" overrides the bundled artifact
        private String modelLocation;

        // Feature columns in the order the scorer was fitted on
        private List<String> features = new ArrayList<>();

        public ScorerSettings() {
        }

        public ScorerSettings(String modelLocation, List<String> features) {
            this.modelLocation = modelLocation;
            this.features = new ArrayList<>(features);
        }
    }
}
