package com.z254.forge.vigil.fusion;

import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.persistence.PersistenceResult;

import java.util.List;
import java.util.Optional;

/**
 * What fusion did with one message.
 *
 * @param alerts      enriched alerts
 * @param alertWrite  empty when the message produced no alert
 * @param auditWrite  always present
 * @param latencyMs   recorded in the audit record
 */
public record FusionResult(List<Alert> alerts, Optional<PersistenceResult> alertWrite,
                           PersistenceResult auditWrite, double latencyMs) {

    public boolean fullyPersisted() {
        return auditWrite.success() && alertWrite.map(PersistenceResult::success).orElse(true);
    }
}
