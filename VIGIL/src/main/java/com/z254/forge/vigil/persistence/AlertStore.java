package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AlertRecord;

/**
 * Destination of alert records.
 */
public interface AlertStore {

    String NAME = "alerts";

    void save(AlertRecord record);

    /**
     * Fail with a runtime exception if the store cannot currently be reached.
     */
    void verifyConnection();
}
