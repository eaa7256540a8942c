package com.z254.forge.vigil.detector.spc;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Statistical process control over a fixed set of signals.
 * <p>
 * Each signal keeps a run counter of consecutive out-of-limit values. An in-limit value
 * resets it. Once the run reaches {@code runLength}, every further violating value of the
 * same run raises a {@code critical} alert.
 * <p>
 * Counters are mutated only by the ingestion loop and may be read concurrently.
 */
public class SpcMonitor {

    public static final String NAME = "spc";

    private final Map<String, MonitoredSignal> signals;
    private final Map<String, Integer> counters = new ConcurrentHashMap<>();
    private final int runLength;

    public SpcMonitor(Collection<MonitoredSignal> signals, int runLength) {
        if (runLength < 1) {
            throw new IllegalArgumentException("runLength must be positive, got " + runLength);
        }
        Map<String, MonitoredSignal> byName = new LinkedHashMap<>();
        for (MonitoredSignal signal : signals) {
            byName.put(signal.name(), signal);
            counters.put(signal.name(), 0);
        }
        this.signals = Collections.unmodifiableMap(byName);
        this.runLength = runLength;
    }

    /**
     * Build the monitor from baseline statistics, falling back to each signal's
     * configured default where the baseline omits its keys.
     */
    public static SpcMonitor fromBaseline(BaselineConfig baseline, VigilProperties.Spc settings) {
        List<MonitoredSignal> signals = new ArrayList<>();
        settings.getSignals().forEach((name, signal) -> {
            ControlLimits limits = ControlLimits.of(
                    baseline.mean(name, signal.getDefaultMean()),
                    baseline.std(name, signal.getDefaultStd()),
                    settings.getSigma(),
                    settings.getMinStd());
            signals.add(new MonitoredSignal(name, signal.getFeature(), signal.getLabel(), limits));
        });
        return new SpcMonitor(signals, settings.getRunLength());
    }

    /**
     * Feed one value of {@code signalName}.
     *
     * @throws IllegalArgumentException if the signal is not monitored
     */
    public Optional<Alert> observe(String signalName, double value) {
        MonitoredSignal signal = signal(signalName);
        ControlLimits limits = signal.limits();

        if (limits.contains(value)) {
            counters.put(signalName, 0);
            return Optional.empty();
        }
        int run = counters.merge(signalName, 1, Integer::sum);
        if (run < runLength) {
            return Optional.empty();
        }

        boolean high = value > limits.ucl();
        double limit = high ? limits.ucl() : limits.lcl();
        String message = String.format(Locale.ROOT, "%s Control Limit Exceeded (%.1f %s %s %.1f) x%d",
                signal.label(), value, high ? ">" : "<", high ? "UCL" : "LCL", limit, runLength);
        return Optional.of(Alert.builder()
                .type(AlertType.SPC_VIOLATION)
                .severity(AlertSeverity.CRITICAL)
                .feature(signal.label())
                .message(message)
                .value(value)
                .limit(limit)
                .build());
    }

    /**
     * Feed every monitored signal from one feature vector, in configuration order.
     */
    public List<Alert> observeAll(FeatureVector vector) {
        List<Alert> alerts = new ArrayList<>();
        for (MonitoredSignal signal : signals.values()) {
            observe(signal.name(), vector.get(signal.feature())).ifPresent(alerts::add);
        }
        return alerts;
    }

    public int violationCount(String signalName) {
        signal(signalName);
        return counters.get(signalName);
    }

    public ControlLimits limits(String signalName) {
        return signal(signalName).limits();
    }

    public Collection<MonitoredSignal> signals() {
        return signals.values();
    }

    private MonitoredSignal signal(String signalName) {
        MonitoredSignal signal = signals.get(signalName);
        if (signal == null) {
            throw new IllegalArgumentException("Unknown SPC signal: " + signalName);
        }
        return signal;
    }
}
