package com.z254.forge.vigil.persistence;

import java.util.Optional;

/**
 * Outcome of one store write.
 */
public record PersistenceResult(String store, boolean success, Throwable error) {

    public static PersistenceResult success(String store) {
        return new PersistenceResult(store, true, null);
    }

    public static PersistenceResult failure(String store, Throwable error) {
        return new PersistenceResult(store, false, error);
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(error);
    }
}
