package com.z254.forge.vigil.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorFeatureTest {

    @Test
    void orderMatchesIndices() {
        List<SensorFeature> ordered = SensorFeature.ordered();

        assertThat(ordered).hasSize(SensorFeature.WIDTH);
        for (int i = 0; i < ordered.size(); i++) {
            assertThat(ordered.get(i).index()).isEqualTo(i);
        }
        assertThat(SensorFeature.orderedFieldNames()).containsExactly(
                "vibration_rms", "temperature", "torque", "pressure", "rotational_speed", "tool_wear");
    }

    @Test
    void contractAcceptsLegacyTemperatureName() {
        SensorFeature.verifyContract(List.of(
                "vibration_rms", "temperature_air", "torque", "pressure", "rotational_speed", "tool_wear"));
    }

    @Test
    void contractRejectsSwappedFeatures() {
        assertThatThrownBy(() -> SensorFeature.verifyContract(List.of(
                "vibration_rms", "torque", "temperature", "pressure", "rotational_speed", "tool_wear")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void contractRejectsWrongWidth() {
        assertThatThrownBy(() -> SensorFeature.verifyContract(List.of("vibration_rms", "temperature")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("width");
    }

    @Test
    void defaultVectorUsesDocumentedDefaults() {
        FeatureVector defaults = FeatureVector.defaults();

        assertThat(defaults.toArray()).containsExactly(0.0, 300.0, 0.0, 1000.0, 2000.0, 0.0);
    }

    @Test
    void withReturnsModifiedCopy() {
        FeatureVector base = FeatureVector.defaults();
        FeatureVector hot = base.with(SensorFeature.TEMPERATURE, 1600.0);

        assertThat(hot.get(SensorFeature.TEMPERATURE)).isEqualTo(1600.0);
        assertThat(base.get(SensorFeature.TEMPERATURE)).isEqualTo(300.0);
        assertThat(hot.asMap()).containsEntry("temperature", 1600.0).hasSize(6);
    }
}
