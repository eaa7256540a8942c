package com.z254.forge.vigil.fusion;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.detector.DetectionOutcome;
import com.z254.forge.vigil.domain.model.Alert;
import com.z254.forge.vigil.domain.model.AlertRecord;
import com.z254.forge.vigil.domain.model.AuditRecord;
import com.z254.forge.vigil.domain.model.SensorReading;
import com.z254.forge.vigil.domain.model.UpstreamNode;
import com.z254.forge.vigil.observability.VigilMetrics;
import com.z254.forge.vigil.observability.VigilStructuredLogger;
import com.z254.forge.vigil.persistence.AlertStore;
import com.z254.forge.vigil.persistence.AuditStore;
import com.z254.forge.vigil.persistence.PersistenceException;
import com.z254.forge.vigil.persistence.PersistencePolicy;
import com.z254.forge.vigil.persistence.PersistenceResult;
import com.z254.forge.vigil.topology.PlantGraph;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns detector output into stored records.
 * <p>
 * For every message:
 * <ol>
 *     <li>each alert is enriched with the upstream dependencies of the machine</li>
 *     <li>an alert record is written when at least one alert exists</li>
 *     <li>an audit record is written unconditionally</li>
 * </ol>
 * Write failures are reported through {@link PersistenceResult}; the per-store
 * {@link PersistencePolicy} decides whether they also fail the message.
 */
@Slf4j
public class AlertFusionService {

    private final PlantGraph plantGraph;
    private final AlertStore alertStore;
    private final AuditStore auditStore;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final VigilStructuredLogger structuredLogger;
    private final Clock clock;

    public AlertFusionService(PlantGraph plantGraph, AlertStore alertStore, AuditStore auditStore,
                              VigilProperties properties, VigilMetrics metrics,
                              VigilStructuredLogger structuredLogger, Clock clock) {
        this.plantGraph = plantGraph;
        this.alertStore = alertStore;
        this.auditStore = auditStore;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Enrich and persist the outcome of one message.
     *
     * @throws PersistenceException if a write failed and its store's policy is
     *                              {@link PersistencePolicy#PROPAGATE}; both writes are
     *                              attempted before this is thrown
     */
    public FusionResult fuse(SensorReading reading, DetectionOutcome outcome) {
        String machineId = reading.machineId();

        // Step 1: upstream context, shared by every alert of the message
        List<Alert> alerts = List.of();
        if (outcome.hasAlerts()) {
            List<UpstreamNode> upstream = plantGraph.getUpstreamDependencies(machineId);
            alerts = outcome.alerts().stream()
                    .map(alert -> alert.withUpstreamContext(upstream))
                    .collect(Collectors.toList());
        }

        // Step 2: alert record
        Optional<PersistenceResult> alertWrite = Optional.empty();
        if (!alerts.isEmpty()) {
            AlertRecord alertRecord = AlertRecord.builder()
                    .timestamp(reading.timestamp())
                    .machineId(machineId)
                    .alerts(alerts)
                    .rawFeatures(reading.features().asMap())
                    .build();
            alertWrite = Optional.of(write(AlertStore.NAME, alertRecord, alertStore::save));
            for (Alert alert : alerts) {
                metrics.recordAlert(alert.getType());
                structuredLogger.logAlert(machineId, alert);
            }
        }

        // Step 3: audit record
        double latencyMs = latencyMs(reading.timestamp());
        AuditRecord auditRecord = AuditRecord.builder()
                .timestamp(reading.timestamp())
                .machineId(machineId)
                .modelVersion(properties.getModels().getVersion())
                .prediction(outcome.prediction())
                .anomalyScore(outcome.anomalyScore())
                .latencyMs(latencyMs)
                .features(reading.features().asMap())
                .alertCount(alerts.size())
                .degradedDetectors(outcome.degradedDetectors())
                .build();
        PersistenceResult auditWrite = write(AuditStore.NAME, auditRecord, auditStore::save);

        alertWrite.ifPresent(result -> applyPolicy(result, properties.getPersistence().getAlertPolicy()));
        applyPolicy(auditWrite, properties.getPersistence().getAuditPolicy());

        return new FusionResult(alerts, alertWrite, auditWrite, latencyMs);
    }

    private <T> PersistenceResult write(String store, T record, Consumer<T> save) {
        try {
            save.accept(record);
            return PersistenceResult.success(store);
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure(store);
            log.warn("Failed to persist {} record: {}", store, e.getMessage());
            return PersistenceResult.failure(store, e);
        }
    }

    private void applyPolicy(PersistenceResult result, PersistencePolicy policy) {
        if (!result.success() && policy == PersistencePolicy.PROPAGATE) {
            throw new PersistenceException("Write to " + result.store() + " store failed", result.error());
        }
    }

    /**
     * Milliseconds between the message timestamp and now. Timestamps without an offset
     * are read as UTC; anything unparseable gives 0.
     */
    double latencyMs(String timestamp) {
        Optional<Instant> sent = parseTimestamp(timestamp);
        if (sent.isEmpty()) {
            return 0.0;
        }
        Duration elapsed = Duration.between(sent.get(), clock.instant());
        return Math.max(0.0, elapsed.getSeconds() * 1000.0 + elapsed.getNano() / 1_000_000.0);
    }

    private static Optional<Instant> parseTimestamp(String timestamp) {
        if (timestamp == null) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(timestamp, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable message timestamp '{}', latency reported as 0", timestamp);
            return Optional.empty();
        }
    }
}
