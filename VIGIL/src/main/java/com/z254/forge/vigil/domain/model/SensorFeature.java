package com.z254.forge.vigil.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Named-field-to-index contract for the feature vector.
 * <p>
 * The pre-trained global model expects exactly these six inputs in exactly this order.
 * Changing an index, adding or removing a constant requires retraining every offline
 * model; {@link #verifyContract(List)} is how loaded artifacts are checked against it.
 */
public enum SensorFeature {

    VIBRATION_RMS(0, "vibration_rms", 0.0),
    TEMPERATURE(1, "temperature", 300.0, "temperature_air"),
    TORQUE(2, "torque", 0.0),
    PRESSURE(3, "pressure", 1000.0),
    ROTATIONAL_SPEED(4, "rotational_speed", 2000.0),
    TOOL_WEAR(5, "tool_wear", 0.0);

    /** Number of features in a vector. */
    public static final int WIDTH = 6;

    private static final List<SensorFeature> ORDERED;

    static {
        SensorFeature[] ordered = new SensorFeature[WIDTH];
        for (SensorFeature feature : values()) {
            if (feature.index < 0 || feature.index >= WIDTH || ordered[feature.index] != null) {
                throw new ExceptionInInitializerError("Invalid feature index for " + feature);
            }
            ordered[feature.index] = feature;
        }
        ORDERED = List.of(ordered);
    }

    private final int index;
    private final String fieldName;
    private final double defaultValue;
    private final Set<String> aliases;

    SensorFeature(int index, String fieldName, double defaultValue, String... aliases) {
        this.index = index;
        this.fieldName = fieldName;
        this.defaultValue = defaultValue;
        this.aliases = Set.of(aliases);
    }

    public int index() {
        return index;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * Value substituted when the field is absent from a message. Defaults sit inside the
     * normal operating envelope so absent telemetry does not read as an outlier.
     */
    public double defaultValue() {
        return defaultValue;
    }

    /** Legacy wire names also accepted for this field. */
    public Set<String> aliases() {
        return aliases;
    }

    /** Features in vector order. */
    public static List<SensorFeature> ordered() {
        return ORDERED;
    }

    /** Field names in vector order. */
    public static List<String> orderedFieldNames() {
        return ORDERED.stream().map(SensorFeature::fieldName).toList();
    }

    public static SensorFeature byIndex(int index) {
        return ORDERED.get(index);
    }

    public static SensorFeature fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.fieldName.equalsIgnoreCase(name)
                        || f.name().equalsIgnoreCase(name)
                        || f.aliases.contains(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sensor feature: " + name));
    }

    /**
     * Check that an externally declared feature order matches this contract.
     *
     * @param declared feature names as recorded by the training pipeline
     * @throws IllegalStateException if width or order differ
     */
    public static void verifyContract(List<String> declared) {
        if (declared == null || declared.size() != WIDTH) {
            throw new IllegalStateException("Feature width mismatch: expected " + WIDTH
                    + " features " + orderedFieldNames() + " but artifact declares "
                    + (declared == null ? Collections.emptyList() : declared));
        }
        for (int i = 0; i < WIDTH; i++) {
            SensorFeature expected = ORDERED.get(i);
            String name = declared.get(i);
            if (!expected.fieldName.equals(name) && !expected.aliases.contains(name)) {
                throw new IllegalStateException("Feature order mismatch at index " + i
                        + ": expected '" + expected.fieldName + "' but artifact declares '" + name + "'");
            }
        }
    }
}
