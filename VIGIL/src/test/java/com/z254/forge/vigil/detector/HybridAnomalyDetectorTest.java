package com.z254.forge.vigil.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.detector.global.GlobalOutlierDetector;
import com.z254.forge.vigil.detector.global.IsolationForestLoader;
import com.z254.forge.vigil.detector.local.LocalOutlierTracker;
import com.z254.forge.vigil.detector.spc.BaselineConfig;
import com.z254.forge.vigil.detector.spc.SpcMonitor;
import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;
import com.z254.forge.vigil.domain.model.SensorFeature;
import com.z254.forge.vigil.domain.model.SensorReading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import static org.assertj.core.api.Assertions.assertThat;

class HybridAnomalyDetectorTest {

    private HybridAnomalyDetector detector;
    private DetectorStatus status;

    @BeforeEach
    void setUp() throws ModelLoadException {
        status = new DetectorStatus();
        GlobalOutlierDetector global = new GlobalOutlierDetector(
                new IsolationForestLoader(new ObjectMapper()).load(new ClassPathResource("models/isolation_forest.json")));
        detector = new HybridAnomalyDetector(global,
                new LocalOutlierTracker(50, 25, 20, 0.1, 1.5),
                SpcMonitor.fromBaseline(BaselineConfig.empty(), new VigilProperties.Spc()),
                status);
    }

    @Test
    void allDetectorsSeeEveryMessage() {
        SensorReading extreme = reading(500.0);

        DetectionOutcome first = detector.detect(extreme);
        detector.detect(extreme);
        DetectionOutcome third = detector.detect(extreme);

        assertThat(first.prediction()).isEqualTo(-1);
        assertThat(first.alerts()).extracting(Alert::getType).containsExactly(AlertType.GLOBAL_OUTLIER);
        assertThat(third.alerts()).extracting(Alert::getType)
                .containsExactly(AlertType.GLOBAL_OUTLIER, AlertType.SPC_VIOLATION);
        assertThat(detector.localTracker().windowSize()).isEqualTo(3);
        assertThat(third.anomalyScore()).isZero();
    }

    @Test
    void normalReadingProducesNoAlerts() {
        DetectionOutcome outcome = detector.detect(reading(100.0));

        assertThat(outcome.hasAlerts()).isFalse();
        assertThat(outcome.prediction()).isEqualTo(1);
        assertThat(outcome.degradedDetectors()).isEmpty();
    }

    @Test
    void auditScoreIsZeroWhenNewestPointIsNotLocalOutlier() {
        DetectionOutcome last = null;
        for (int i = 0; i < 25; i++) {
            last = detector.detect(reading(100.0));
        }

        assertThat(detector.localTracker().windowSize()).isEqualTo(25);
        assertThat(last.anomalyScore()).isZero();
    }

    @Test
    void auditScoreCarriesFactorOfLocalOutlier() {
        for (int i = 0; i < 24; i++) {
            detector.detect(new SensorReading("2024-05-01T10:00:00Z", "M-006", spread(i)));
        }

        DetectionOutcome outcome = detector.detect(new SensorReading("2024-05-01T10:00:00Z", "M-006",
                FeatureVector.fromArray(25.0, 900.0, 400.0, 5000.0, 9000.0, 250.0)));

        assertThat(outcome.anomalyScore()).isGreaterThan(1.5);
        assertThat(outcome.alerts()).filteredOn(alert -> alert.getType() == AlertType.LOCAL_OUTLIER)
                .singleElement()
                .satisfies(alert -> assertThat(alert.getScore()).isEqualTo(outcome.anomalyScore()));
    }

    @Test
    void reportsDegradedDetectors() {
        status.markDegraded(SpcMonitor.NAME, "baseline missing");

        DetectionOutcome outcome = detector.detect(reading(100.0));

        assertThat(outcome.degradedDetectors()).containsExactly("spc");
    }

    private static FeatureVector spread(int i) {
        return FeatureVector.fromArray(
                1.0 + 0.02 * (i % 25),
                300.0 + (i % 6) * 0.5,
                40.0 + (i % 4) * 0.3,
                1000.0 + (i % 3),
                2000.0 + (i % 5) * 2.0,
                10.0 + (i % 25) * 0.1);
    }

    private static SensorReading reading(double torque) {
        FeatureVector vector = FeatureVector.defaults()
                .with(SensorFeature.TORQUE, torque)
                .with(SensorFeature.TEMPERATURE, 1580.0);
        return new SensorReading("2024-05-01T10:00:00Z", "M-006", vector);
    }
}
