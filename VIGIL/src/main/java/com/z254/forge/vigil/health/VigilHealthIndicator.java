package com.z254.forge.vigil.health;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.detector.HybridAnomalyDetector;
import com.z254.forge.vigil.detector.spc.BaselineConfig;
import com.z254.forge.vigil.detector.spc.ControlLimits;
import com.z254.forge.vigil.detector.spc.MonitoredSignal;
import com.z254.forge.vigil.stream.ConnectionState;
import com.z254.forge.vigil.stream.SensorStreamConsumer;
import com.z254.forge.vigil.topology.PlantGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the VIGIL detector.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Stream connection state</li>
 *     <li>Detectors running in degraded mode</li>
 *     <li>Local window fill and SPC limits with their current run counters</li>
 * </ul>
 * Only the connection state decides UP or DOWN; a degraded detector is reported but the
 * service keeps serving.
 */
@Slf4j
@Component
public class VigilHealthIndicator implements ReactiveHealthIndicator {

    private final SensorStreamConsumer streamConsumer;
    private final HybridAnomalyDetector detector;
    private final BaselineConfig baselineConfig;
    private final PlantGraph plantGraph;
    private final VigilProperties properties;

    public VigilHealthIndicator(SensorStreamConsumer streamConsumer,
                                HybridAnomalyDetector detector,
                                BaselineConfig baselineConfig,
                                PlantGraph plantGraph,
                                VigilProperties properties) {
        this.streamConsumer = streamConsumer;
        this.detector = detector;
        this.baselineConfig = baselineConfig;
        this.plantGraph = plantGraph;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        ConnectionState state = streamConsumer.connectionState();
        details.put("stream.state", state.name());
        details.put("stream.topic", properties.getKafka().getSensorTopic());
        streamConsumer.lastMessageAt().ifPresent(at -> details.put("stream.lastMessageAt", at.toString()));

        details.put("model.version", properties.getModels().getVersion());
        detector.globalDetector().modelVersion().ifPresent(v -> details.put("model.globalArtifact", v));
        if (baselineConfig.getThreshold() != null) {
            details.put("model.threshold", baselineConfig.getThreshold());
        }
        details.put("detectors.degraded", detector.status().reasons());

        details.put("local.windowSize", detector.localTracker().windowSize());
        details.put("local.windowCapacity", detector.localTracker().capacity());

        for (MonitoredSignal signal : detector.spcMonitor().signals()) {
            ControlLimits limits = signal.limits();
            Map<String, Object> spc = new LinkedHashMap<>();
            spc.put("mean", limits.mean());
            spc.put("lcl", limits.lcl());
            spc.put("ucl", limits.ucl());
            spc.put("violations", detector.spcMonitor().violationCount(signal.name()));
            details.put("spc." + signal.name(), spc);
        }

        details.put("topology.nodes", plantGraph.nodeCount());

        if (state == ConnectionState.LISTENING) {
            return Health.up().withDetails(details).build();
        }
        log.debug("Health DOWN, stream state {}", state);
        return Health.down().withDetails(details).build();
    }
}
