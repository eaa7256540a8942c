package com.z254.forge.vigil.feature;

/**
 * A sensor message that cannot be turned into a feature vector. The message is dropped.
 */
public class MalformedReadingException extends RuntimeException {

    public MalformedReadingException(String message) {
        super(message);
    }

    public MalformedReadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
