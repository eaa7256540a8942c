package com.z254.forge.vigil.domain.model;

/**
 * Typed view of one sensor message after extraction.
 *
 * @param timestamp ISO-8601 timestamp as sent by the producer
 * @param machineId physical machine identifier
 * @param features  extracted feature vector
 */
public record SensorReading(String timestamp, String machineId, FeatureVector features) {
}
