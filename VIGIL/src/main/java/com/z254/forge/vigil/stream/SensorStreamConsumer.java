package com.z254.forge.vigil.stream;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.detector.DetectionOutcome;
import com.z254.forge.vigil.detector.HybridAnomalyDetector;
import com.z254.forge.vigil.domain.model.SensorReading;
import com.z254.forge.vigil.feature.FeatureExtractor;
import com.z254.forge.vigil.feature.MalformedReadingException;
import com.z254.forge.vigil.fusion.AlertFusionService;
import com.z254.forge.vigil.observability.VigilMetrics;
import com.z254.forge.vigil.observability.VigilStructuredLogger;
import com.z254.forge.vigil.observability.VigilStructuredLogger.LifecycleEventType;
import com.z254.forge.vigil.persistence.AlertStore;
import com.z254.forge.vigil.persistence.AuditStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Long-running ingestion loop.
 * <p>
 * State machine:
 * <pre>
 * DISCONNECTED -> CONNECTING -> LISTENING
 *      ^              |              |
 *      +-- failure ---+-- conn lost -+
 * </pre>
 * Connecting subscribes to the feed and checks both stores; any failure waits the fixed
 * retry delay and tries again, forever. While listening, every payload is extracted, run
 * through the detectors and fused. A failure of one message never stops the loop.
 * <p>
 * The loop owns a dedicated thread. {@link #stop()} wakes a blocking poll and lets the
 * batch in flight finish.
 */
@Slf4j
@Component
public class SensorStreamConsumer implements SmartLifecycle {

    private final SensorFeed feed;
    private final FeatureExtractor extractor;
    private final HybridAnomalyDetector detector;
    private final AlertFusionService fusionService;
    private final AlertStore alertStore;
    private final AuditStore auditStore;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final VigilStructuredLogger structuredLogger;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean running;
    private volatile SensorSubscription subscription;
    private volatile Instant lastMessageAt;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private Thread worker;

    public SensorStreamConsumer(SensorFeed feed,
                                FeatureExtractor extractor,
                                HybridAnomalyDetector detector,
                                AlertFusionService fusionService,
                                AlertStore alertStore,
                                AuditStore auditStore,
                                VigilProperties properties,
                                VigilMetrics metrics,
                                VigilStructuredLogger structuredLogger) {
        this.feed = feed;
        this.extractor = extractor;
        this.detector = detector;
        this.fusionService = fusionService;
        this.alertStore = alertStore;
        this.auditStore = auditStore;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    // ==================== Lifecycle ====================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopSignal = new CountDownLatch(1);
        worker = new Thread(this::runLoop, "vigil-stream");
        worker.start();
    }

    @Override
    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
            current = worker;
        }
        SensorSubscription open = subscription;
        if (open != null) {
            open.wakeup();
        }
        try {
            current.join(properties.getIngestion().getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            log.warn("Stream loop did not stop within {}", properties.getIngestion().getShutdownTimeout());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getIngestion().isAutoStart();
    }

    public ConnectionState connectionState() {
        return state;
    }

    public Optional<Instant> lastMessageAt() {
        return Optional.ofNullable(lastMessageAt);
    }

    // ==================== Loop ====================

    void runLoop() {
        Duration retryDelay = properties.getIngestion().getRetryDelay();
        while (running) {
            try {
                if (subscription == null) {
                    if (!connect() && running) {
                        pause(retryDelay);
                    }
                    continue;
                }
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Stream loop failed, reconnecting: {}", e.getMessage(), e);
                closeSubscription();
                state = ConnectionState.DISCONNECTED;
                metrics.recordReconnectAttempt();
                if (running) {
                    pause(retryDelay);
                }
            }
        }
        closeSubscription();
        state = ConnectionState.DISCONNECTED;
        structuredLogger.logLifecycleEvent(LifecycleEventType.STOPPED, "Stream loop stopped",
                Map.of("channel", feed.channel()));
    }

    private boolean connect() {
        state = ConnectionState.CONNECTING;
        structuredLogger.logLifecycleEvent(LifecycleEventType.CONNECTING, "Connecting to sensor stream",
                Map.of("channel", feed.channel()));
        SensorSubscription opened = null;
        try {
            opened = feed.subscribe();
            alertStore.verifyConnection();
            auditStore.verifyConnection();
        } catch (FeedConnectionException | RuntimeException e) {
            if (opened != null) {
                opened.close();
            }
            state = ConnectionState.DISCONNECTED;
            metrics.recordReconnectAttempt();
            structuredLogger.logLifecycleEvent(LifecycleEventType.CONNECT_FAILED, "Connection attempt failed",
                    Map.of("channel", feed.channel(),
                            "error", String.valueOf(e.getMessage()),
                            "retryInMs", properties.getIngestion().getRetryDelay().toMillis()));
            return false;
        }
        subscription = opened;
        state = ConnectionState.LISTENING;
        structuredLogger.logLifecycleEvent(LifecycleEventType.CONNECTED, "Listening on sensor stream",
                Map.of("channel", feed.channel()));
        return true;
    }

    private void pollOnce() {
        List<String> payloads;
        try {
            payloads = subscription.poll(properties.getKafka().getPollTimeout());
        } catch (FeedConnectionException e) {
            structuredLogger.logLifecycleEvent(LifecycleEventType.CONNECTION_LOST, "Sensor stream connection lost",
                    Map.of("channel", feed.channel(), "error", String.valueOf(e.getMessage())));
            closeSubscription();
            state = ConnectionState.DISCONNECTED;
            return;
        }
        for (String payload : payloads) {
            processPayload(payload);
        }
    }

    /**
     * Run one payload end to end. Never throws.
     */
    void processPayload(String payload) {
        metrics.recordReceived();
        lastMessageAt = Instant.now();
        Timer.Sample sample = metrics.startProcessingTimer();

        SensorReading reading;
        try {
            reading = extractor.parse(payload);
        } catch (MalformedReadingException e) {
            metrics.recordDropped();
            metrics.recordProcessingLatency(sample);
            log.warn("Dropping malformed message: {}", e.getMessage());
            return;
        }

        try (VigilStructuredLogger.MDCScope ignored = structuredLogger.withContext(Map.of(
                VigilStructuredLogger.MDC_MACHINE_ID, reading.machineId(),
                VigilStructuredLogger.MDC_CORRELATION_ID, UUID.randomUUID().toString()))) {
            DetectionOutcome outcome = detector.detect(reading);
            fusionService.fuse(reading, outcome);
            metrics.recordProcessed();
        } catch (RuntimeException e) {
            metrics.recordFailed();
            log.error("Failed to process message for machine {}: {}", reading.machineId(), e.getMessage(), e);
        } finally {
            metrics.recordProcessingLatency(sample);
        }
    }

    private void pause(Duration delay) {
        try {
            stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void closeSubscription() {
        SensorSubscription open = subscription;
        subscription = null;
        if (open != null) {
            open.close();
        }
    }
}
