package com.z254.forge.vigil.detector.global;

/**
 * Verdict of the global model, with the numeric code reported in audit records.
 */
public enum OutlierLabel {
    INLIER(1),
    OUTLIER(-1);

    private final int code;

    OutlierLabel(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Negative decision values are outliers; zero is an inlier.
     */
    public static OutlierLabel fromDecision(double decision) {
        return decision < 0 ? OUTLIER : INLIER;
    }
}
