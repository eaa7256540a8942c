package com.z254.forge.vigil.detector.spc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Baseline statistics exported alongside the trained models.
 * <pre>
 * {"spc": {"torque_mean": 40.1, "torque_std": 9.8, ...}, "threshold": 0.62}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineConfig {

    private Map<String, Double> spc = new LinkedHashMap<>();

    private Double threshold;

    public static BaselineConfig empty() {
        return new BaselineConfig();
    }

    public Optional<Double> statistic(String key) {
        return Optional.ofNullable(spc).map(stats -> stats.get(key));
    }

    public double mean(String signal, double fallback) {
        return statistic(signal + "_mean").orElse(fallback);
    }

    public double std(String signal, double fallback) {
        return statistic(signal + "_std").orElse(fallback);
    }
}
