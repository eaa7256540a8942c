package com.z254.forge.vigil.health;

import com.z254.forge.vigil.config.VigilProperties;
import com.z254.forge.vigil.detector.DetectorStatus;
import com.z254.forge.vigil.detector.HybridAnomalyDetector;
import com.z254.forge.vigil.detector.global.GlobalOutlierDetector;
import com.z254.forge.vigil.detector.local.LocalOutlierTracker;
import com.z254.forge.vigil.detector.spc.BaselineConfig;
import com.z254.forge.vigil.detector.spc.SpcMonitor;
import com.z254.forge.vigil.stream.ConnectionState;
import com.z254.forge.vigil.stream.SensorStreamConsumer;
import com.z254.forge.vigil.topology.PlantGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VigilHealthIndicatorTest {

    @Mock
    private SensorStreamConsumer streamConsumer;

    private VigilHealthIndicator indicator;
    private DetectorStatus status;

    @BeforeEach
    void setUp() {
        VigilProperties properties = new VigilProperties();
        status = new DetectorStatus();
        HybridAnomalyDetector detector = new HybridAnomalyDetector(GlobalOutlierDetector.unavailable(),
                new LocalOutlierTracker(50, 25, 20, 0.1, 1.5),
                SpcMonitor.fromBaseline(BaselineConfig.empty(), properties.getSpc()),
                status);
        BaselineConfig baseline = new BaselineConfig();
        baseline.setThreshold(0.62);
        indicator = new VigilHealthIndicator(streamConsumer, detector, baseline, PlantGraph.empty(), properties);
    }

    @Test
    void upWhileListening() {
        when(streamConsumer.connectionState()).thenReturn(ConnectionState.LISTENING);
        when(streamConsumer.lastMessageAt()).thenReturn(Optional.of(Instant.parse("2024-05-01T10:00:00Z")));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("stream.state", "LISTENING")
                            .containsEntry("stream.lastMessageAt", "2024-05-01T10:00:00Z")
                            .containsEntry("model.threshold", 0.62)
                            .containsEntry("local.windowCapacity", 50)
                            .containsKeys("spc.torque", "spc.temp");
                    @SuppressWarnings("unchecked")
                    Map<String, Object> torque = (Map<String, Object>) health.getDetails().get("spc.torque");
                    assertThat(torque).containsEntry("ucl", 101.5).containsEntry("violations", 0);
                })
                .verifyComplete();
    }

    @Test
    void downWhileReconnectingAndReportsDegradedDetectors() {
        status.markDegraded(GlobalOutlierDetector.NAME, "model file missing");
        when(streamConsumer.connectionState()).thenReturn(ConnectionState.CONNECTING);
        when(streamConsumer.lastMessageAt()).thenReturn(Optional.empty());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails().get("detectors.degraded"))
                            .isEqualTo(Map.of("global_outlier", "model file missing"));
                })
                .verifyComplete();
    }
}
