package com.z254.forge.vigil.domain.model;

/**
 * Detector that produced an alert.
 */
public enum AlertType {
    /** Pre-trained multivariate model flagged the vector */
    GLOBAL_OUTLIER,
    /** Vector deviates from the recent sliding window */
    LOCAL_OUTLIER,
    /** Consecutive control-limit violations on a monitored signal */
    SPC_VIOLATION
}
