package com.z254.forge.vigil.observability;

import com.z254.forge.vigil.domain.model.AlertType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the VIGIL detector.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Message flow (received, processed, dropped, failed)</li>
 *     <li>Alerts by detector type</li>
 *     <li>Persistence failures by store</li>
 *     <li>Bus reconnects and per-message latency</li>
 * </ul>
 */
@Component
public class VigilMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter messagesReceived;
    @Getter
    private final Counter messagesProcessed;
    @Getter
    private final Counter messagesDropped;
    @Getter
    private final Counter messagesFailed;
    @Getter
    private final Counter reconnectAttempts;
    private final Timer processingLatency;
    private final Map<AlertType, Counter> alertsByType = new ConcurrentHashMap<>();
    private final Map<String, Counter> persistenceFailuresByStore = new ConcurrentHashMap<>();

    public VigilMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.messagesReceived = Counter.builder("vigil.stream.messages.received")
                .description("Messages received from the sensor stream")
                .register(meterRegistry);
        this.messagesProcessed = Counter.builder("vigil.stream.messages.processed")
                .description("Messages run through all detectors")
                .register(meterRegistry);
        this.messagesDropped = Counter.builder("vigil.stream.messages.dropped")
                .description("Malformed messages dropped at extraction")
                .register(meterRegistry);
        this.messagesFailed = Counter.builder("vigil.stream.messages.failed")
                .description("Messages that failed during detection or persistence")
                .register(meterRegistry);
        this.reconnectAttempts = Counter.builder("vigil.stream.reconnects")
                .description("Failed connection attempts followed by a retry")
                .register(meterRegistry);
        this.processingLatency = Timer.builder("vigil.stream.latency")
                .description("Per-message processing latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    public void recordReceived() {
        messagesReceived.increment();
    }

    public void recordProcessed() {
        messagesProcessed.increment();
    }

    public void recordDropped() {
        messagesDropped.increment();
    }

    public void recordFailed() {
        messagesFailed.increment();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.increment();
    }

    public void recordAlert(AlertType type) {
        alertsByType.computeIfAbsent(type, t ->
                Counter.builder("vigil.alerts")
                        .tag("type", t.name())
                        .description("Alerts emitted by detector type")
                        .register(meterRegistry))
                .increment();
    }

    public void recordPersistenceFailure(String store) {
        persistenceFailuresByStore.computeIfAbsent(store, s ->
                Counter.builder("vigil.persistence.failures")
                        .tag("store", s)
                        .description("Failed store writes")
                        .register(meterRegistry))
                .increment();
    }

    public Timer.Sample startProcessingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordProcessingLatency(Timer.Sample sample) {
        sample.stop(processingLatency);
    }
}
