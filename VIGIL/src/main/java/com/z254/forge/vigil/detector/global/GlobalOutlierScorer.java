package com.z254.forge.vigil.detector.global;

import com.z254.forge.vigil.domain.model.FeatureVector;

/**
 * Pre-trained multivariate outlier model. Implementations are immutable after load and
 * safe to call from any thread.
 */
public interface GlobalOutlierScorer {

    /**
     * Signed decision value: negative for outliers, non-negative for inliers.
     */
    double decision(FeatureVector vector);

    default OutlierLabel classify(FeatureVector vector) {
        return OutlierLabel.fromDecision(decision(vector));
    }

    String version();
}
