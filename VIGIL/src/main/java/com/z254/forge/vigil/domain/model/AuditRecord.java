package com.z254.forge.vigil.domain.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;
import java.util.Map;

/**
 * Audit store document: one per processed message, alert or not.
 */
@Value
@Builder
public class AuditRecord {

    String timestamp;

    @Field("machine_id")
    String machineId;

    @Field("model_version")
    String modelVersion;

    /** Global model verdict: 1 inlier, -1 outlier, 0 when the model is unavailable */
    int prediction;

    /** Local outlier factor of the newest point when it is a local outlier, otherwise 0.0 */
    @Field("anomaly_score")
    double anomalyScore;

    @Field("latency_ms")
    double latencyMs;

    Map<String, Double> features;

    @Field("alert_count")
    int alertCount;

    @Field("degraded_detectors")
    List<String> degradedDetectors;
}
