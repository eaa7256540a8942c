package com.z254.forge.vigil.detector.global;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.detector.ModelLoadException;
import com.z254.forge.vigil.domain.model.FeatureVector;
import com.z254.forge.vigil.domain.model.SensorFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IsolationForestModelTest {

    private IsolationForestModel model;

    @BeforeEach
    void setUp() throws ModelLoadException {
        model = new IsolationForestLoader(new ObjectMapper())
                .load(new ClassPathResource("models/isolation_forest.json"));
    }

    @Test
    void averagePathLengthMatchesDefinition() {
        assertThat(IsolationForestModel.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationForestModel.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestModel.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    void pointInDenseLeafIsInlier() {
        FeatureVector normal = FeatureVector.defaults().with(SensorFeature.TORQUE, 100.0);

        assertThat(model.decision(normal)).isCloseTo(0.0325, within(1e-3));
        assertThat(model.classify(normal)).isEqualTo(OutlierLabel.INLIER);
    }

    @Test
    void isolatedPointIsOutlier() {
        FeatureVector extreme = FeatureVector.defaults().with(SensorFeature.TORQUE, 500.0);

        assertThat(model.decision(extreme)).isCloseTo(-0.4346, within(1e-3));
        assertThat(model.classify(extreme)).isEqualTo(OutlierLabel.OUTLIER);
    }

    @Test
    void splitSendsThresholdValueLeft() {
        FeatureVector boundary = FeatureVector.defaults().with(SensorFeature.TORQUE, 150.0);

        assertThat(model.classify(boundary)).isEqualTo(OutlierLabel.INLIER);
    }

    @Test
    void exposesArtifactMetadata() {
        assertThat(model.version()).isEqualTo("if-test-1");
        assertThat(model.treeCount()).isEqualTo(1);
    }
}
