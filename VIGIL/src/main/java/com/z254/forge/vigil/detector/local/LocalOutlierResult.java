package com.z254.forge.vigil.detector.local;

import com.z254.forge.vigil.domain.model.Alert;

import java.util.Optional;

/**
 * Outcome of one local outlier observation.
 *
 * @param evaluated whether the window was large enough to score
 * @param factor    local outlier factor of the newest point, 0.0 when not evaluated
 * @param outlier   whether the newest point fell in the contamination tail
 * @param alert     present only for outliers above the factor threshold
 */
public record LocalOutlierResult(boolean evaluated, double factor, boolean outlier, Optional<Alert> alert) {

    static final LocalOutlierResult NOT_EVALUATED = new LocalOutlierResult(false, 0.0, false, Optional.empty());
}
