package com.z254.forge.vigil.detector.local;

import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalOutlierTrackerTest {

    private LocalOutlierTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new LocalOutlierTracker(50, 25, 20, 0.1, 1.5);
    }

    @Test
    void startsEmpty() {
        assertThat(tracker.windowSize()).isZero();
        assertThat(tracker.capacity()).isEqualTo(50);
    }

    @Test
    void doesNotEvaluateBeforeMinimumFill() {
        for (int i = 0; i < 24; i++) {
            LocalOutlierResult result = tracker.observe(normal(i));

            assertThat(result.evaluated()).isFalse();
            assertThat(result.alert()).isEmpty();
        }
        assertThat(tracker.windowSize()).isEqualTo(24);
    }

    @Test
    void extremeVectorAlertsOnceWindowIsFull() {
        for (int i = 0; i < 24; i++) {
            tracker.observe(normal(i));
        }

        LocalOutlierResult result = tracker.observe(extreme());

        assertThat(result.evaluated()).isTrue();
        assertThat(result.outlier()).isTrue();
        assertThat(result.factor()).isGreaterThan(1.5);
        assertThat(result.alert()).hasValueSatisfying(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.LOCAL_OUTLIER);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.INFO);
            assertThat(alert.getScore()).isEqualTo(result.factor());
            assertThat(alert.getMessage()).startsWith("Local deviation detected (Factor: ");
        });
    }

    @Test
    void outlierBelowFactorThresholdRaisesNoAlert() {
        LocalOutlierTracker lenient = new LocalOutlierTracker(50, 25, 20, 0.1, 1_000_000.0);
        for (int i = 0; i < 24; i++) {
            lenient.observe(normal(i));
        }

        LocalOutlierResult result = lenient.observe(extreme());

        assertThat(result.outlier()).isTrue();
        assertThat(result.alert()).isEmpty();
    }

    @Test
    void evictsOldestBeyondCapacity() {
        for (int i = 0; i < 60; i++) {
            tracker.observe(normal(i));
        }

        assertThat(tracker.windowSize()).isEqualTo(50);
        assertThat(tracker.windowSnapshot().get(0)).isEqualTo(normal(10));
        assertThat(tracker.windowSnapshot().get(49)).isEqualTo(normal(59));
    }

    @Test
    void rejectsMinimumAboveCapacity() {
        assertThatThrownBy(() -> new LocalOutlierTracker(10, 20, 5, 0.1, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static FeatureVector normal(int i) {
        return FeatureVector.fromArray(
                1.0 + 0.02 * (i % 25),
                300.0 + (i % 6) * 0.5,
                40.0 + (i % 4) * 0.3,
                1000.0 + (i % 3),
                2000.0 + (i % 5) * 2.0,
                10.0 + (i % 25) * 0.1);
    }

    private static FeatureVector extreme() {
        return FeatureVector.fromArray(25.0, 900.0, 400.0, 5000.0, 9000.0, 250.0);
    }
}
