package com.z254.forge.vigil.persistence;

/**
 * A store write failed under {@link PersistencePolicy#PROPAGATE}.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
