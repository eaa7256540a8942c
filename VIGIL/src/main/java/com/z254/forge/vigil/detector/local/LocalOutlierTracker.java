package com.z254.forge.vigil.detector.local;

import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertSeverity;
import com.z254.forge.vigil.domain.model.AlertType;
import com.z254.forge.vigil.domain.model.FeatureVector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sliding-window local outlier detector.
 * <p>
 * Each observation enters a bounded FIFO window. Once the window holds {@code minWindow}
 * vectors, the local outlier factor of every window point is recomputed and only the
 * newest point is judged: it is an outlier when its negative factor falls below the
 * contamination percentile of the window, and it raises an {@code info} alert when its
 * factor also exceeds the configured threshold.
 * <p>
 * Not thread-safe; owned by the single ingestion loop. The window is never persisted.
 */
public class LocalOutlierTracker {

    private final int capacity;
    private final int minWindow;
    private final int neighbors;
    private final double contamination;
    private final double factorThreshold;
    private final Deque<FeatureVector> window = new ArrayDeque<>();

    public LocalOutlierTracker(int capacity, int minWindow, int neighbors,
                               double contamination, double factorThreshold) {
        if (capacity < 2 || minWindow < 2 || minWindow > capacity) {
            throw new IllegalArgumentException("Window requires 2 <= minWindow <= capacity, got minWindow="
                    + minWindow + ", capacity=" + capacity);
        }
        this.capacity = capacity;
        this.minWindow = minWindow;
        this.neighbors = neighbors;
        this.contamination = contamination;
        this.factorThreshold = factorThreshold;
    }

    public LocalOutlierResult observe(FeatureVector vector) {
        window.addLast(vector);
        while (window.size() > capacity) {
            window.removeFirst();
        }
        if (window.size() < minWindow) {
            return LocalOutlierResult.NOT_EVALUATED;
        }

        double[] negativeFactors = LocalOutlierFactor.negativeOutlierFactors(new ArrayList<>(window), neighbors);
        double newest = negativeFactors[negativeFactors.length - 1];
        double offset = LocalOutlierFactor.percentile(negativeFactors, contamination);
        double factor = -newest;
        boolean outlier = newest < offset;

        if (!outlier || factor <= factorThreshold) {
            return new LocalOutlierResult(true, factor, outlier, Optional.empty());
        }
        Alert alert = Alert.builder()
                .type(AlertType.LOCAL_OUTLIER)
                .severity(AlertSeverity.INFO)
                .message(String.format(Locale.ROOT, "Local deviation detected (Factor: %.2f)", factor))
                .score(factor)
                .build();
        return new LocalOutlierResult(true, factor, true, Optional.of(alert));
    }

    public int windowSize() {
        return window.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Snapshot of the window, oldest first.
     */
    public List<FeatureVector> windowSnapshot() {
        return List.copyOf(window);
    }
}
