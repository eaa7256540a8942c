package com.z254.forge.vigil.detector.global;

import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;

import java.util.Optional;

/**
 * Global outlier stage of the hybrid detector.
 * <p>
 * Runs in degraded mode when no model could be loaded: every vector is then reported as
 * unscored and no alert is raised.
 */
public class GlobalOutlierDetector {

    public static final String NAME = "global_outlier";
    static final String ALERT_MESSAGE = "Global multivariate anomaly detected (Isolation Forest)";

    private final GlobalOutlierScorer scorer;

    public GlobalOutlierDetector(GlobalOutlierScorer scorer) {
        this.scorer = scorer;
    }

    public static GlobalOutlierDetector unavailable() {
        return new GlobalOutlierDetector(null);
    }

    public boolean isAvailable() {
        return scorer != null;
    }

    public Optional<String> modelVersion() {
        return Optional.ofNullable(scorer).map(GlobalOutlierScorer::version);
    }

    public Result evaluate(FeatureVector vector) {
        if (scorer == null) {
            return new Result(null, Optional.empty());
        }
        double decision = scorer.decision(vector);
        OutlierLabel label = OutlierLabel.fromDecision(decision);
        if (label == OutlierLabel.INLIER) {
            return new Result(label, Optional.empty());
        }
        Alert alert = Alert.builder()
                .type(AlertType.GLOBAL_OUTLIER)
                .severity(AlertSeverity.WARNING)
                .message(ALERT_MESSAGE)
                .score(decision)
                .build();
        return new Result(label, Optional.of(alert));
    }

    /**
     * @param label null when the detector is unavailable
     */
    public record Result(OutlierLabel label, Optional<Alert> alert) {

        /** Audit code: 1 inlier, -1 outlier, 0 unscored */
        public int predictionCode() {
            return label != null ? label.code() : 0;
        }
    }
}
