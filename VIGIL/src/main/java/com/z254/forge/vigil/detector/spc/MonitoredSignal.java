package com.z254.forge.vigil.detector.spc;

import com.z254.forge.vigil.domain.model.SensorFeature;

/**
 * A signal under statistical process control.
 *
 * @param name    baseline key prefix, e.g. {@code torque}
 * @param feature feature vector slot the value is read from
 * @param label   human-readable name used in alerts
 */
public record MonitoredSignal(String name, SensorFeature feature, String label, ControlLimits limits) {
}
