package com.z254.forge.vigil.domain.model;

/**
 * Plant node criticality grade, A being the most critical.
 */
public enum Criticality {
    A, B, C;

    public static Criticality parse(String value) {
        if (value == null || value.isBlank()) {
            return C;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return C;
        }
    }
}
