package com.z254.forge.vigil.config;

import com.z254.forge.vigil.domain.model.SensorFeature;
import com.z254.forge.vigil.persistence.PersistencePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the VIGIL detector service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Sensor stream subscription and reconnect policy</li>
 *     <li>Model artifact and topology locations</li>
 *     <li>Local outlier and SPC detector parameters</li>
 *     <li>Alert and audit persistence</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {

    private final Kafka kafka = new Kafka();
    private final Ingestion ingestion = new Ingestion();
    private final Models models = new Models();
    private final Topology topology = new Topology();
    private final Local local = new Local();
    private final Spc spc = new Spc();
    private final Persistence persistence = new Persistence();

    /**
     * Sensor stream subscription.
     */
    @Data
    public static class Kafka {
        @NotBlank
        private String sensorTopic = "sensor_stream";

        @NotBlank
        private String groupId = "vigil-detector";

        /** Upper bound of a single blocking poll */
        private Duration pollTimeout = Duration.ofSeconds(1);
    }

    /**
     * Stream ingestion loop behaviour.
     */
    @Data
    public static class Ingestion {
        /** Start the loop with the application context */
        private boolean autoStart = true;

        /** Fixed delay between reconnect attempts; retries never give up */
        private Duration retryDelay = Duration.ofSeconds(5);

        /** Bound on a single connect attempt (broker metadata, store ping) */
        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Grace period for the in-flight message on shutdown */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    /**
     * Pre-trained artifacts.
     */
    @Data
    public static class Models {
        /** Exported isolation forest */
        private String globalModel = "file:models/isolation_forest.json";

        /** Baseline statistics and decision threshold */
        private String config = "file:models/model_config.json";

        /** Reported in every audit record */
        private String version = "v2.1 (IF+LOF+SPC)";
    }

    /**
     * Plant dependency graph.
     */
    @Data
    public static class Topology {
        private String location = "file:data/plant_topology.json";

        @Positive
        private int ancestorCacheSize = 1000;
    }

    /**
     * Sliding-window local outlier factor.
     */
    @Data
    public static class Local {
        @Positive
        private int windowCapacity = 50;

        /** Window size before the first evaluation */
        @Positive
        private int minWindow = 25;

        @Positive
        private int neighbors = 20;

        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double contamination = 0.1;

        /** Factor above which a local outlier raises an alert */
        private double factorThreshold = 1.5;
    }

    /**
     * Statistical process control.
     */
    @Data
    public static class Spc {
        private double sigma = 3.0;

        /** Consecutive violations before the first alert */
        @Positive
        private int runLength = 3;

        /** Floor applied to baseline standard deviations */
        private double minStd = 0.01;

        /** Monitored signals keyed by baseline prefix ({prefix}_mean, {prefix}_std) */
        private Map<String, Signal> signals = defaultSignals();

        private static Map<String, Signal> defaultSignals() {
            Map<String, Signal> signals = new LinkedHashMap<>();
            signals.put("torque", new Signal(SensorFeature.TORQUE, "Torque", 100.0, 0.5));
            signals.put("temp", new Signal(SensorFeature.TEMPERATURE, "Temperature", 1580.0, 10.0));
            return signals;
        }
    }

    /**
     * One SPC-monitored signal. The defaults apply when the baseline file omits its keys.
     */
    @Data
    public static class Signal {
        private SensorFeature feature;
        private String label;
        private double defaultMean;
        private double defaultStd;

        public Signal() {
        }

        public Signal(SensorFeature feature, String label, double defaultMean, double defaultStd) {
            this.feature = feature;
            this.label = label;
            this.defaultMean = defaultMean;
            this.defaultStd = defaultStd;
        }
    }

    /**
     * Alert and audit stores.
     */
    @Data
    public static class Persistence {
        /** Use MongoDB; otherwise records are kept in memory */
        private boolean mongoEnabled = true;

        @NotBlank
        private String alertCollection = "anomaly_events";

        @NotBlank
        private String auditCollection = "model_audit_log";

        private PersistencePolicy alertPolicy = PersistencePolicy.SWALLOW;

        private PersistencePolicy auditPolicy = PersistencePolicy.SWALLOW;

        /** Capacity of the in-memory stores */
        @Positive
        private int inMemoryCapacity = 10_000;
    }
}
