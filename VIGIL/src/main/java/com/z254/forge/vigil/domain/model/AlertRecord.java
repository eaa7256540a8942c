package com.z254.forge.vigil.domain.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;
import java.util.Map;

/**
 * Alert store document: one per message that produced at least one alert.
 */
@Value
@Builder
public class AlertRecord {

    String timestamp;

    @Field("machine_id")
    String machineId;

    List<Alert> alerts;

    @Field("raw_features")
    Map<String, Double> rawFeatures;
}
