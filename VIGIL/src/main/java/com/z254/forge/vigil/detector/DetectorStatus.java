package com.z254.forge.vigil.detector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detectors running in degraded mode after a failed model or baseline load, with the
 * reason. Filled once during startup.
 */
public class DetectorStatus {

    private final Map<String, String> degraded = Collections.synchronizedMap(new LinkedHashMap<>());

    public void markDegraded(String detector, String reason) {
        degraded.put(detector, reason);
    }

    public boolean isDegraded(String detector) {
        return degraded.containsKey(detector);
    }

    public List<String> degradedDetectors() {
        synchronized (degraded) {
            return List.copyOf(degraded.keySet());
        }
    }

    public Map<String, String> reasons() {
        synchronized (degraded) {
            return Map.copyOf(degraded);
        }
    }
}
