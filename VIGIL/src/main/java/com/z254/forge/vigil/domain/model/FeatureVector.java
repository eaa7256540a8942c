package com.z254.forge.vigil.domain.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable fixed-width feature vector indexed by {@link SensorFeature}.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(Map<SensorFeature, Double> values) {
        double[] array = new double[SensorFeature.WIDTH];
        for (SensorFeature feature : SensorFeature.ordered()) {
            Double value = values.get(feature);
            array[feature.index()] = value != null ? value : feature.defaultValue();
        }
        return new FeatureVector(array);
    }

    /**
     * Build from a raw array in contract order.
     */
    public static FeatureVector fromArray(double... values) {
        if (values.length != SensorFeature.WIDTH) {
            throw new IllegalArgumentException("Expected " + SensorFeature.WIDTH
                    + " values but got " + values.length);
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector defaults() {
        return of(new EnumMap<>(SensorFeature.class));
    }

    public double get(SensorFeature feature) {
        return values[feature.index()];
    }

    public double get(int index) {
        return values[index];
    }

    public FeatureVector with(SensorFeature feature, double value) {
        double[] copy = values.clone();
        copy[feature.index()] = value;
        return new FeatureVector(copy);
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Field name to value, in contract order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (SensorFeature feature : SensorFeature.ordered()) {
            map.put(feature.fieldName(), values[feature.index()]);
        }
        return map;
    }

    public double distanceTo(FeatureVector other) {
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double d = values[i] - other.values[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }
}
