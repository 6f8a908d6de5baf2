package com.evcharge.anomaly.engine;

import com.evcharge.anomaly.config.MetricsConfig;
import com.evcharge.anomaly.engine.detectors.OutlierScoringDetector;
import com.evcharge.anomaly.engine.detectors.TemporalConflictDetector;
import com.evcharge.anomaly.model.AnomalyType;
import com.evcharge.anomaly.model.CanonicalColumns;
import com.evcharge.anomaly.model.Finding;
import com.evcharge.anomaly.model.SessionDataset;
import com.evcharge.anomaly.model.SessionRow;
import com.evcharge.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

class AggregationEngineTest {

    private SimpleMeterRegistry registry;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
    }

    private AggregationEngine engine(AnomalyDetector... detectors) {
        return new AggregationEngine(List.of(detectors), Tracer.NOOP, metricsConfig);
    }

    private OutlierScoringDetector dosDetector() {
        return new OutlierScoringDetector("DoS", AnomalyType.DOS_ATTACK, "DoS",
                List.of(CanonicalColumns.CPU_USAGE_PERCENT, CanonicalColumns.PACKETS_PER_SEC),
                "CPU: %s%%, Packets: %s/sec", TestDataFactory.createDosScorer());
    }

    private OutlierScoringDetector fraudDetector() {
        return new OutlierScoringDetector("Billing Fraud", AnomalyType.BILLING_FRAUD, "Fraud",
                List.of(CanonicalColumns.ENERGY_KWH, CanonicalColumns.AMOUNT_INR),
                "Energy: %s kWh, Amount: %s INR", TestDataFactory.createFraudScorer());
    }

    private AggregationEngine fullEngine() {
        // Registration order differs from execution order on purpose
        return engine(new TemporalConflictDetector(), fraudDetector(), dosDetector());
    }

    @Test
    void aggregate_noAnomalies_returnsEmptyResult() {
        SessionDataset dataset = TestDataFactory.createDataset(
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.createSession("S2", "U2", "2024-03-01 10:10:00", "2024-03-01 10:40:00"));

        AggregationResult result = fullEngine().aggregate(dataset);

        assertThat(result.findings()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void aggregate_sessionFlaggedByAllDetectors_mergesInExecutionOrder() {
        Map<String, String> first = TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00");
        Map<String, String> second = TestDataFactory.createSession("S2", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00");
        second = TestDataFactory.withValue(second, CanonicalColumns.CPU_USAGE_PERCENT, "98");
        second = TestDataFactory.withValue(second, CanonicalColumns.PACKETS_PER_SEC, "4000");
        second = TestDataFactory.withValue(second, CanonicalColumns.AMOUNT_INR, "0");

        AggregationResult result = fullEngine().aggregate(TestDataFactory.createDataset(first, second));

        assertThat(result.findings()).hasSize(1);
        Finding finding = result.findings().get(0);
        assertThat(finding.getSessionId()).isEqualTo("S2");
        assertThat(finding.getAnomalyType()).isEqualTo("dos_attack+billing_fraud+multi_user_conflict");
        assertThat(finding.getDetails()).isEqualTo(
                "CPU: 98%, Packets: 4000/sec"
                        + "; Fraud: Energy: 40.0 kWh, Amount: 0 INR"
                        + "; Conflict: User: U1, Start: 2024-03-01T10:10:00, End: 2024-03-01T10:40:00");
        assertThat(finding.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 10));
    }

    @Test
    void aggregate_findingsKeepFirstFlagOrder() {
        Map<String, String> a = TestDataFactory.createSession("A", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00");
        Map<String, String> b = TestDataFactory.withValue(
                TestDataFactory.createSession("B", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00"),
                CanonicalColumns.AMOUNT_INR, "0");
        Map<String, String> c = TestDataFactory.withValue(
                TestDataFactory.createSession("C", "U2", "2024-03-01 11:00:00", "2024-03-01 11:30:00"),
                CanonicalColumns.CPU_USAGE_PERCENT, "99");

        AggregationResult result = fullEngine().aggregate(TestDataFactory.createDataset(a, b, c));

        // C is created by the DoS pass, B by the fraud pass, then the conflict pass extends B
        assertThat(result.findings()).extracting(Finding::getSessionId).containsExactly("C", "B");
        assertThat(result.findings().get(1).getAnomalyType()).isEqualTo("billing_fraud+multi_user_conflict");
    }

    @Test
    void aggregate_missingSessionId_throwsValidationError() {
        List<String> columns = List.of(CanonicalColumns.USER_ID, CanonicalColumns.START_TIME, CanonicalColumns.END_TIME);
        SessionDataset dataset = TestDataFactory.createDataset(columns,
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"));

        DatasetValidationException error = catchThrowableOfType(
                () -> fullEngine().aggregate(dataset), DatasetValidationException.class);

        assertThat(error).hasMessage("Essential columns missing: [session_id]. Cannot proceed.");
        assertThat(error.getMissingColumns()).containsExactly(CanonicalColumns.SESSION_ID);
    }

    @Test
    void aggregate_missingInfraColumns_skipsDosAndRunsTheRest() {
        List<String> columns = List.of(CanonicalColumns.SESSION_ID, CanonicalColumns.USER_ID,
                CanonicalColumns.START_TIME, CanonicalColumns.END_TIME,
                CanonicalColumns.ENERGY_KWH, CanonicalColumns.AMOUNT_INR);
        SessionDataset dataset = TestDataFactory.createDataset(columns,
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.createSession("S2", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00"),
                TestDataFactory.withValue(
                        TestDataFactory.createSession("S3", "U2", "2024-03-01 12:00:00", "2024-03-01 12:30:00"),
                        CanonicalColumns.ENERGY_KWH, "400"));

        AggregationResult result = fullEngine().aggregate(dataset);

        assertThat(result.diagnostics()).containsExactly(
                "Skipping DoS detection: Missing one or more required columns ([cpu_usage_percent, packets_per_sec])");
        assertThat(result.findings()).extracting(Finding::getSessionId).containsExactly("S3", "S2");
        assertThat(registry.get("detector.run.count")
                .tag("anomaly_type", "dos_attack").tag("outcome", "skipped")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void aggregate_detectorReportsFailure_addsDiagnosticAndContinues() {
        AnomalyDetector failing = new StubDetector(AnomalyType.DOS_ATTACK, "DoS", Set.of(),
                dataset -> DetectionOutcome.failure("Skipping DoS detection: no rows with valid numeric values"));
        AggregationEngine engine = engine(failing, new TemporalConflictDetector());

        AggregationResult result = engine.aggregate(TestDataFactory.createDataset(
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.createSession("S2", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00")));

        assertThat(result.diagnostics()).containsExactly("Skipping DoS detection: no rows with valid numeric values");
        assertThat(result.findings()).extracting(Finding::getSessionId).containsExactly("S2");
    }

    @Test
    void aggregate_detectorThrows_isIsolated() {
        AnomalyDetector broken = new StubDetector(AnomalyType.BILLING_FRAUD, "Billing Fraud", Set.of(),
                dataset -> {
                    throw new IllegalStateException("boom");
                });
        AggregationEngine engine = engine(dosDetector(), broken, new TemporalConflictDetector());

        AggregationResult result = engine.aggregate(TestDataFactory.createDataset(
                TestDataFactory.withValue(
                        TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                        CanonicalColumns.PACKETS_PER_SEC, "5000")));

        assertThat(result.diagnostics()).containsExactly("Billing Fraud detection failed: boom");
        assertThat(result.findings()).hasSize(1);
        assertThat(result.findings().get(0).getAnomalyType()).isEqualTo("dos_attack");
        assertThat(registry.get("detector.run.count")
                .tag("anomaly_type", "billing_fraud").tag("outcome", "failed")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void aggregate_duplicateSessionRows_labelAddedOnce() {
        Map<String, String> row = TestDataFactory.withValue(
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                CanonicalColumns.CPU_USAGE_PERCENT, "97");
        Map<String, String> repeat = TestDataFactory.withValue(row, CanonicalColumns.AMOUNT_INR, "0");

        AggregationResult result = engine(dosDetector(), fraudDetector())
                .aggregate(TestDataFactory.createDataset(row, repeat));

        assertThat(result.findings()).hasSize(1);
        Finding finding = result.findings().get(0);
        assertThat(finding.getAnomalyTypes()).containsExactly(AnomalyType.DOS_ATTACK, AnomalyType.BILLING_FRAUD);
        assertThat(finding.getDetails()).isEqualTo(
                "CPU: 97%, Packets: 120/sec; Fraud: Energy: 40.0 kWh, Amount: 0 INR");
    }

    @Test
    void aggregate_blankSessionId_isIgnored() {
        AnomalyDetector flagsEverything = new StubDetector(AnomalyType.DOS_ATTACK, "DoS", Set.of(),
                dataset -> {
                    List<DetectedSession> all = new ArrayList<>();
                    for (SessionRow row : dataset.getRows()) {
                        all.add(new DetectedSession(row, "evidence"));
                    }
                    return DetectionOutcome.success(all);
                });

        AggregationResult result = engine(flagsEverything).aggregate(TestDataFactory.createDataset(
                TestDataFactory.createSession("  ", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.createSession("S2", "U2", "2024-03-01 10:00:00", "2024-03-01 10:30:00")));

        assertThat(result.findings()).extracting(Finding::getSessionId).containsExactly("S2");
    }

    @Test
    void aggregate_findingsAreFrozen() {
        AggregationResult result = fullEngine().aggregate(TestDataFactory.createDataset(
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.createSession("S2", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00")));

        Finding finding = result.findings().get(0);
        assertThat(finding.isFrozen()).isTrue();
        assertThatThrownBy(() -> finding.append(AnomalyType.DOS_ATTACK, "DoS", "late"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void aggregate_rerunOnSameDataset_isIdentical() {
        SessionDataset dataset = TestDataFactory.createDataset(
                TestDataFactory.createSession("S1", "U1", "2024-03-01 10:00:00", "2024-03-01 10:30:00"),
                TestDataFactory.withValue(
                        TestDataFactory.createSession("S2", "U1", "2024-03-01 10:10:00", "2024-03-01 10:40:00"),
                        CanonicalColumns.CPU_USAGE_PERCENT, "95"));
        AggregationEngine engine = fullEngine();

        AggregationResult first = engine.aggregate(dataset);
        AggregationResult second = engine.aggregate(dataset);

        assertThat(second.findings()).extracting(Finding::getSessionId, Finding::getAnomalyType, Finding::getDetails)
                .containsExactlyElementsOf(first.findings().stream()
                        .map(f -> tuple(f.getSessionId(), f.getAnomalyType(), f.getDetails()))
                        .toList());
        assertThat(second.diagnostics()).isEqualTo(first.diagnostics());
    }

    @Test
    void constructor_twoDetectorsForSameType_rejected() {
        assertThatThrownBy(() -> engine(dosDetector(),
                new StubDetector(AnomalyType.DOS_ATTACK, "Other DoS", Set.of(), d -> DetectionOutcome.success(List.of()))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DOS_ATTACK");
    }

    private static final class StubDetector implements AnomalyDetector {
        private final AnomalyType type;
        private final String name;
        private final Set<String> required;
        private final Function<SessionDataset, DetectionOutcome> behaviour;

        StubDetector(AnomalyType type, String name, Set<String> required,
                     Function<SessionDataset, DetectionOutcome> behaviour) {
            this.type = type;
            this.name = name;
            this.required = required;
            this.behaviour = behaviour;
        }

        @Override
        public AnomalyType getAnomalyType() {
            return type;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getEvidencePrefix() {
            return name;
        }

        @Override
        public Set<String> requiredColumns() {
            return required;
        }

        @Override
        public DetectionOutcome detect(SessionDataset dataset) {
            return behaviour.apply(dataset);
        }
    }
}
