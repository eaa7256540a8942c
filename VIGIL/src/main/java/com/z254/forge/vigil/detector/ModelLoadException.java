package com.z254.forge.vigil.detector;

/**
 * A model artifact or baseline file could not be loaded. Disables the dependent detector.
 */
public class ModelLoadException extends Exception {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
