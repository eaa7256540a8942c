package com.z254.forge.vigil.detector.spc;

/**
 * Shewhart control limits of one signal.
 */
public record ControlLimits(double mean, double std, double lcl, double ucl) {

    /**
     * Limits at {@code mean +- sigma * std}, with {@code std} floored at {@code minStd}.
     */
    public static ControlLimits of(double mean, double std, double sigma, double minStd) {
        double effectiveStd = Math.max(std, minStd);
        return new ControlLimits(mean, effectiveStd, mean - sigma * effectiveStd, mean + sigma * effectiveStd);
    }

    public boolean contains(double value) {
        return value >= lcl && value <= ucl;
    }
}
