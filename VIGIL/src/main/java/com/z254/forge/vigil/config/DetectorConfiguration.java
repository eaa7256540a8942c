package com.z254.forge.vigil.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.detector.DetectorStatus;
import com.z254.forge.vigil.detector.HybridAnomalyDetector;
import com.z254.forge.vigil.detector.ModelLoadException;
import com.z254.forge.vigil.detector.global.GlobalOutlierDetector;
import com.z254.forge.vigil.detector.global.IsolationForestLoader;
import com.z254.forge.vigil.detector.local.LocalOutlierTracker;
import com.z254.forge.vigil.detector.spc.BaselineConfig;
import com.z254.forge.vigil.detector.spc.BaselineConfigLoader;
import com.z254.forge.vigil.detector.spc.SpcMonitor;
import com.z254.forge.vigil.fusion.AlertFusionService;
import com.z254.forge.vigil.observability.VigilMetrics;
import com.z254.forge.vigil.observability.VigilStructuredLogger;
import com.z254.forge.vigil.observability.VigilStructuredLogger.LifecycleEventType;
import com.z254.forge.vigil.persistence.AlertStore;
import com.z254.forge.vigil.persistence.AuditStore;
import com.z254.forge.vigil.persistence.InMemoryAlertStore;
import com.z254.forge.vigil.persistence.InMemoryAuditStore;
import com.z254.forge.vigil.persistence.MongoAlertStore;
import com.z254.forge.vigil.persistence.MongoAuditStore;
import com.z254.forge.vigil.topology.PlantGraph;
import com.z254.forge.vigil.topology.PlantGraphLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Loads model artifacts and wires the detection pipeline.
 * <p>
 * A model or baseline that fails to load puts its detector in degraded mode; the service
 * still starts.
 */
@Slf4j
@Configuration
public class DetectorConfiguration {

    private final VigilProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final VigilStructuredLogger structuredLogger;

    public DetectorConfiguration(VigilProperties properties, ResourceLoader resourceLoader,
                                 ObjectMapper objectMapper, VigilStructuredLogger structuredLogger) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DetectorStatus detectorStatus() {
        return new DetectorStatus();
    }

    // ==================== Detectors ====================

    @Bean
    public GlobalOutlierDetector globalOutlierDetector(DetectorStatus status) {
        String location = properties.getModels().getGlobalModel();
        try {
            GlobalOutlierDetector detector = new GlobalOutlierDetector(
                    new IsolationForestLoader(objectMapper).load(resourceLoader.getResource(location)));
            structuredLogger.logLifecycleEvent(LifecycleEventType.DETECTOR_READY, "Global outlier model loaded",
                    Map.of("detector", GlobalOutlierDetector.NAME, "location", location));
            return detector;
        } catch (ModelLoadException e) {
            status.markDegraded(GlobalOutlierDetector.NAME, e.getMessage());
            structuredLogger.logLifecycleEvent(LifecycleEventType.DETECTOR_DEGRADED,
                    "Global outlier model unavailable, running without it",
                    Map.of("detector", GlobalOutlierDetector.NAME, "location", location,
                            "error", String.valueOf(e.getMessage())));
            return GlobalOutlierDetector.unavailable();
        }
    }

    @Bean
    public BaselineConfig baselineConfig(DetectorStatus status) {
        String location = properties.getModels().getConfig();
        try {
            return new BaselineConfigLoader(objectMapper).load(resourceLoader.getResource(location));
        } catch (ModelLoadException e) {
            status.markDegraded(SpcMonitor.NAME, e.getMessage());
            structuredLogger.logLifecycleEvent(LifecycleEventType.DETECTOR_DEGRADED,
                    "Baseline config unavailable, SPC running on default limits",
                    Map.of("detector", SpcMonitor.NAME, "location", location,
                            "error", String.valueOf(e.getMessage())));
            return BaselineConfig.empty();
        }
    }

    @Bean
    public SpcMonitor spcMonitor(BaselineConfig baselineConfig) {
        SpcMonitor monitor = SpcMonitor.fromBaseline(baselineConfig, properties.getSpc());
        monitor.signals().forEach(signal -> log.info("SPC limits for {}: mean={}, lcl={}, ucl={}",
                signal.name(), signal.limits().mean(), signal.limits().lcl(), signal.limits().ucl()));
        return monitor;
    }

    @Bean
    public LocalOutlierTracker localOutlierTracker() {
        VigilProperties.Local local = properties.getLocal();
        return new LocalOutlierTracker(local.getWindowCapacity(), local.getMinWindow(), local.getNeighbors(),
                local.getContamination(), local.getFactorThreshold());
    }

    @Bean
    public HybridAnomalyDetector hybridAnomalyDetector(GlobalOutlierDetector globalOutlierDetector,
                                                       LocalOutlierTracker localOutlierTracker,
                                                       SpcMonitor spcMonitor,
                                                       DetectorStatus status) {
        return new HybridAnomalyDetector(globalOutlierDetector, localOutlierTracker, spcMonitor, status);
    }

    // ==================== Topology and persistence ====================

    @Bean
    public PlantGraph plantGraph() {
        VigilProperties.Topology topology = properties.getTopology();
        return new PlantGraphLoader(objectMapper)
                .load(resourceLoader.getResource(topology.getLocation()), topology.getAncestorCacheSize());
    }

    @Bean
    public AlertStore alertStore(ObjectProvider<MongoTemplate> mongoTemplate) {
        VigilProperties.Persistence persistence = properties.getPersistence();
        if (persistence.isMongoEnabled()) {
            return new MongoAlertStore(mongoTemplate.getObject(), persistence.getAlertCollection());
        }
        log.info("MongoDB disabled, alert records kept in memory");
        return new InMemoryAlertStore(persistence.getInMemoryCapacity());
    }

    @Bean
    public AuditStore auditStore(ObjectProvider<MongoTemplate> mongoTemplate) {
        VigilProperties.Persistence persistence = properties.getPersistence();
        if (persistence.isMongoEnabled()) {
            return new MongoAuditStore(mongoTemplate.getObject(), persistence.getAuditCollection());
        }
        log.info("MongoDB disabled, audit records kept in memory");
        return new InMemoryAuditStore(persistence.getInMemoryCapacity());
    }

    @Bean
    public AlertFusionService alertFusionService(PlantGraph plantGraph, AlertStore alertStore,
                                                 AuditStore auditStore, VigilMetrics metrics, Clock clock) {
        return new AlertFusionService(plantGraph, alertStore, auditStore, properties, metrics,
                structuredLogger, clock);
    }
}
