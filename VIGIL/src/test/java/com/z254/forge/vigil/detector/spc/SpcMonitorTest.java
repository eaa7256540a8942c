package com.z254.forge.vigil.detector.spc;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;
import com.z254.forge.vigil.domain.model.SensorFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpcMonitorTest {

    private SpcMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = SpcMonitor.fromBaseline(BaselineConfig.empty(), new VigilProperties.Spc());
    }

    @Test
    @DisplayName("three consecutive high torque values raise one alert, an in-limit value resets")
    void debouncesHighViolations() {
        List<Integer> counters = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();

        for (double value : new double[]{101.6, 101.7, 101.8, 99.0}) {
            monitor.observe("torque", value).ifPresent(alerts::add);
            counters.add(monitor.violationCount("torque"));
        }

        assertThat(counters).containsExactly(1, 2, 3, 0);
        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.SPC_VIOLATION);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getFeature()).isEqualTo("Torque");
        assertThat(alert.getValue()).isEqualTo(101.8);
        assertThat(alert.getLimit()).isEqualTo(101.5);
        assertThat(alert.getMessage()).isEqualTo("Torque Control Limit Exceeded (101.8 > UCL 101.5) x3");
    }

    @Test
    void keepsAlertingWhileRunPersists() {
        long alertCount = 0;
        for (int i = 0; i < 5; i++) {
            if (monitor.observe("torque", 102.0).isPresent()) {
                alertCount++;
            }
        }

        assertThat(alertCount).isEqualTo(3);
        assertThat(monitor.violationCount("torque")).isEqualTo(5);
    }

    @Test
    void lowSideViolationReportsLowerLimit() {
        monitor.observe("torque", 98.0);
        monitor.observe("torque", 98.0);
        Optional<Alert> alert = monitor.observe("torque", 98.0);

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getLimit()).isEqualTo(98.5);
            assertThat(a.getMessage()).isEqualTo("Torque Control Limit Exceeded (98.0 < LCL 98.5) x3");
        });
    }

    @Test
    void limitValuesAreInControl() {
        monitor.observe("torque", 101.5);
        monitor.observe("torque", 98.5);

        assertThat(monitor.violationCount("torque")).isZero();
    }

    @Test
    void countersAreIndependentPerSignal() {
        monitor.observe("torque", 105.0);
        monitor.observe("temp", 1580.0);

        assertThat(monitor.violationCount("torque")).isEqualTo(1);
        assertThat(monitor.violationCount("temp")).isZero();
    }

    @Test
    void observeAllReadsConfiguredFeatures() {
        FeatureVector hot = FeatureVector.defaults()
                .with(SensorFeature.TORQUE, 100.0)
                .with(SensorFeature.TEMPERATURE, 1700.0);

        List<Alert> alerts = List.of();
        for (int i = 0; i < 3; i++) {
            alerts = monitor.observeAll(hot);
        }

        assertThat(alerts).singleElement()
                .satisfies(alert -> assertThat(alert.getFeature()).isEqualTo("Temperature"));
        assertThat(monitor.violationCount("torque")).isZero();
    }

    @Test
    void baselineOverridesDefaultsAndStdIsFloored() {
        BaselineConfig baseline = new BaselineConfig();
        baseline.setSpc(Map.of("torque_mean", 40.0, "torque_std", 0.0));

        SpcMonitor fitted = SpcMonitor.fromBaseline(baseline, new VigilProperties.Spc());

        ControlLimits torque = fitted.limits("torque");
        assertThat(torque.mean()).isEqualTo(40.0);
        assertThat(torque.std()).isEqualTo(0.01);
        assertThat(torque.ucl()).isCloseTo(40.03, within(1e-9));
        assertThat(torque.lcl()).isCloseTo(39.97, within(1e-9));
        assertThat(fitted.limits("temp").ucl()).isCloseTo(1610.0, within(1e-9));
    }

    @Test
    void rejectsUnknownSignal() {
        assertThatThrownBy(() -> monitor.observe("pressure", 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pressure");
        assertThatThrownBy(() -> monitor.violationCount("pressure"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
