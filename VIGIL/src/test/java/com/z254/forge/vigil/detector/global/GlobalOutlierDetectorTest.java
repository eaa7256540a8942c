package com.z254.forge.vigil.detector.global;

import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GlobalOutlierDetectorTest {

    @Mock
    private GlobalOutlierScorer scorer;

    @Test
    void inlierRaisesNoAlert() {
        FeatureVector vector = FeatureVector.defaults();
        when(scorer.decision(vector)).thenReturn(0.12);

        GlobalOutlierDetector.Result result = new GlobalOutlierDetector(scorer).evaluate(vector);

        assertThat(result.label()).isEqualTo(OutlierLabel.INLIER);
        assertThat(result.predictionCode()).isEqualTo(1);
        assertThat(result.alert()).isEmpty();
    }

    @Test
    void outlierRaisesOneWarning() {
        FeatureVector vector = FeatureVector.defaults();
        when(scorer.decision(vector)).thenReturn(-0.2);

        GlobalOutlierDetector.Result result = new GlobalOutlierDetector(scorer).evaluate(vector);

        assertThat(result.predictionCode()).isEqualTo(-1);
        assertThat(result.alert()).hasValueSatisfying(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.GLOBAL_OUTLIER);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(alert.getMessage()).isEqualTo("Global multivariate anomaly detected (Isolation Forest)");
            assertThat(alert.getScore()).isEqualTo(-0.2);
        });
    }

    @Test
    void zeroDecisionIsInlier() {
        FeatureVector vector = FeatureVector.defaults();
        when(scorer.decision(vector)).thenReturn(0.0);

        GlobalOutlierDetector.Result result = new GlobalOutlierDetector(scorer).evaluate(vector);

        assertThat(result.label()).isEqualTo(OutlierLabel.fromDecision(0.0)).isEqualTo(OutlierLabel.INLIER);
        assertThat(result.alert()).isEmpty();
    }

    @Test
    void evaluationAgreesWithClassification() {
        GlobalOutlierScorer fixed = new GlobalOutlierScorer() {
            @Override
            public double decision(FeatureVector vector) {
                return -0.01;
            }

            @Override
            public String version() {
                return "fixed";
            }
        };
        FeatureVector vector = FeatureVector.defaults();

        assertThat(new GlobalOutlierDetector(fixed).evaluate(vector).label())
                .isEqualTo(fixed.classify(vector))
                .isEqualTo(OutlierLabel.OUTLIER);
    }

    @Test
    void unavailableDetectorReportsUnscored() {
        GlobalOutlierDetector detector = GlobalOutlierDetector.unavailable();

        GlobalOutlierDetector.Result result = detector.evaluate(FeatureVector.defaults());

        assertThat(detector.isAvailable()).isFalse();
        assertThat(detector.modelVersion()).isEmpty();
        assertThat(result.predictionCode()).isZero();
        assertThat(result.alert()).isEmpty();
    }
}
