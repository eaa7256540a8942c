package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AuditRecord;

/**
 * Destination of audit records.
 */
public interface AuditStore {

    String NAME = "audit";

    void save(AuditRecord record);

    /**
     * Fail with a runtime exception if the store cannot currently be reached.
     */
    void verifyConnection();
}
