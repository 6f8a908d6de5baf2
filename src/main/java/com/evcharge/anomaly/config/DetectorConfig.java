package com.evcharge.anomaly.config;

import com.evcharge.anomaly.engine.detectors.OutlierScoringDetector;
import com.evcharge.anomaly.engine.scoring.PipelineScorer;
import com.evcharge.anomaly.engine.scoring.Scorer;
import com.evcharge.anomaly.engine.scoring.ScorerArtifact;
import com.evcharge.anomaly.engine.scoring.UnavailableScorer;
import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.repository.ScorerArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two scorer-backed detectors. Each scorer is loaded once at start-up;
 * a missing or broken artifact leaves that detector failing on every run instead
 * of stopping the application.
 */
@Configuration
public class DetectorConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfig.class);

    static final String DOS_EVIDENCE = "CPU: %s%%, Packets: %s/sec";
    static final String FRAUD_EVIDENCE = "Energy: %s kWh, Amount: %s INR";

    private final DetectionProperties properties;
    private final ScorerArtifactRepository artifactRepository;

    public DetectorConfig(DetectionProperties properties, ScorerArtifactRepository artifactRepository) {
        this.properties = properties;
        this.artifactRepository = artifactRepository;
    }

    @Bean
    public OutlierScoringDetector dosAttackDetector() {
        DetectionProperties.ScorerSettings settings = properties.getDos();
        return new OutlierScoringDetector("DoS", AnomalyType.DOS_ATTACK, "DoS",
                settings.getFeatures(), DOS_EVIDENCE, loadScorer("dos", settings));
    }

    @Bean
    public OutlierScoringDetector billingFraudDetector() {
        DetectionProperties.ScorerSettings settings = properties.getFraud();
        return new OutlierScoringDetector("Billing Fraud", AnomalyType.BILLING_FRAUD, "Fraud",
                settings.getFeatures(), FRAUD_EVIDENCE, loadScorer("fraud", settings));
    }

    private Scorer loadScorer(String id, DetectionProperties.ScorerSettings settings) {
        ScorerArtifact artifact = artifactRepository.load(settings.getModelLocation());
        if (artifact == null) {
            return new UnavailableScorer(id, "artifact could not be read from " + settings.getModelLocation());
        }

        try {
            PipelineScorer scorer = PipelineScorer.from(artifact);
            if (!scorer.getFeatures().isEmpty() && !scorer.getFeatures().equals(settings.getFeatures())) {
                log.warn("Scorer {} was fitted on {} but the detector is configured with {}",
                        scorer.getId(), scorer.getFeatures(), settings.getFeatures());
            }
            log.info("Loaded scorer {} v{} from {}", scorer.getId(), scorer.getVersion(), settings.getModelLocation());
            return scorer;
        } catch (IllegalArgumentException e) {
            log.error("Scorer artifact at {} is invalid: {}", settings.getModelLocation(), e.getMessage());
            return new UnavailableScorer(id, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scorer artifact at {} could not be built", settings.getModelLocation(), e);
            return new UnavailableScorer(id, "artifact could not be built: " + e);
        }
    }
}
