package com.z254.forge.vigil.observability;

import com.z254.forge.vigil.domain.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the detector.
 * <p>
 * Emits {@code message | data={...}} lines and manages MDC scopes so every log line
 * written while a message is processed carries its machine id.
 */
@Slf4j
@Component
public class VigilStructuredLogger {

    public static final String MDC_MACHINE_ID = "machineId";
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * Log an alert emitted for a machine.
     */
    public void logAlert(String machineId, Alert alert) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "ALERT");
        logData.put("machineId", machineId);
        logData.put("type", alert.getType().name());
        logData.put("severity", alert.getSeverity().label());
        if (alert.getScore() != null) {
            logData.put("score", alert.getScore());
        }
        if (alert.getValue() != null) {
            logData.put("value", alert.getValue());
            logData.put("limit", alert.getLimit());
        }
        logData.put("upstreamNodes", alert.getUpstreamContext().size());

        switch (alert.getSeverity()) {
            case CRITICAL -> log.warn("{} | data={}", alert.getMessage(), formatLogData(logData));
            case WARNING -> log.info("{} | data={}", alert.getMessage(), formatLogData(logData));
            default -> log.debug("{} | data={}", alert.getMessage(), formatLogData(logData));
        }
    }

    /**
     * Log a lifecycle event of the ingestion loop or a detector.
     */
    public void logLifecycleEvent(LifecycleEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case CONNECTION_LOST, CONNECT_FAILED, DETECTOR_DEGRADED ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum LifecycleEventType {
        CONNECTING, CONNECTED, CONNECT_FAILED, CONNECTION_LOST, STOPPED,
        DETECTOR_READY, DETECTOR_DEGRADED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
