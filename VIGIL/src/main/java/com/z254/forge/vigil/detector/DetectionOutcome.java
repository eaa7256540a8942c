package com.z254.forge.vigil.detector;

import com.z254.forge.vigil.domain.model.Alert;

import java.util.List;

/**
 * Combined result of the three detectors for one message.
 *
 * @param alerts            in detector order: global, local, SPC
 * @param prediction        global label code: 1 inlier, -1 outlier, 0 unscored
 * @param anomalyScore      local outlier factor when the message is a local outlier, otherwise 0.0
 * @param degradedDetectors detectors that ran without their model or baseline
 */
public record DetectionOutcome(List<Alert> alerts, int prediction, double anomalyScore,
                               List<String> degradedDetectors) {

    public DetectionOutcome {
        alerts = List.copyOf(alerts);
        degradedDetectors = List.copyOf(degradedDetectors);
    }

    public boolean hasAlerts() {
        return !alerts.isEmpty();
    }
}
