package com.z254.forge.vigil.detector;

import com.z254.forge.vigil.detector.global.GlobalOutlierDetector;
import com.z254.forge.vigil.detector.local.LocalOutlierResult;
import com.z254.forge.vigil.detector.local.LocalOutlierTracker;
import com.z254.forge.vigil.detector.spc.SpcMonitor;
import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.FeatureVector;
import com.z254.forge.vigil.domain.model.SensorReading;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the global, local and SPC detectors over one reading.
 * <p>
 * All three always run and in that order, so that the local window and SPC counters see
 * every message regardless of what the global stage decides.
 */
@Slf4j
public class HybridAnomalyDetector {

    private final GlobalOutlierDetector globalDetector;
    private final LocalOutlierTracker localTracker;
    private final SpcMonitor spcMonitor;
    private final DetectorStatus status;

    public HybridAnomalyDetector(GlobalOutlierDetector globalDetector, LocalOutlierTracker localTracker,
                                 SpcMonitor spcMonitor, DetectorStatus status) {
        this.globalDetector = globalDetector;
        this.localTracker = localTracker;
        this.spcMonitor = spcMonitor;
        this.status = status;
    }

    public DetectionOutcome detect(SensorReading reading) {
        FeatureVector vector = reading.features();
        List<Alert> alerts = new ArrayList<>(3);

        GlobalOutlierDetector.Result global = globalDetector.evaluate(vector);
        global.alert().ifPresent(alerts::add);

        LocalOutlierResult local = localTracker.observe(vector);
        local.alert().ifPresent(alerts::add);

        alerts.addAll(spcMonitor.observeAll(vector));

        if (log.isDebugEnabled()) {
            log.debug("Detection for {}: prediction={}, localEvaluated={}, factor={}, alerts={}",
                    reading.machineId(), global.predictionCode(), local.evaluated(), local.factor(), alerts.size());
        }
        double anomalyScore = local.outlier() ? local.factor() : 0.0;
        return new DetectionOutcome(alerts, global.predictionCode(), anomalyScore, status.degradedDetectors());
    }

    public GlobalOutlierDetector globalDetector() {
        return globalDetector;
    }

    public LocalOutlierTracker localTracker() {
        return localTracker;
    }

    public SpcMonitor spcMonitor() {
        return spcMonitor;
    }

    public DetectorStatus status() {
        return status;
    }
}
