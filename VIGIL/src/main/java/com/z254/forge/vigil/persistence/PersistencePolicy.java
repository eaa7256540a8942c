package com.z254.forge.vigil.persistence;

/**
 * What a failed store write does to the message being processed.
 */
public enum PersistencePolicy {
    /** Log and count the failure, keep processing (best-effort, at-most-once) */
    SWALLOW,
    /** Fail the message with a {@link PersistenceException} */
    PROPAGATE
}
