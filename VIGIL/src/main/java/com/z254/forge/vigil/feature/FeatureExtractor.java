package com.z254.forge.vigil.feature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.domain.model.FeatureVector;
import com.z254.forge.vigil.domain.model.SensorFeature;
import com.z254.forge.vigil.domain.model.SensorReading;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Turns raw sensor messages into typed {@link SensorReading}s.
 * <p>
 * Absent fields (or explicit JSON nulls) take the documented default of their
 * {@link SensorFeature}. Any present field that is not a finite number, or a numeric
 * string, fails the whole message. Extraction has no side effects, so extracting the
 * same message twice yields equal vectors.
 */
@Component
public class FeatureExtractor {

    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_MACHINE_ID = "machine_id";
    public static final String UNKNOWN_MACHINE = "unknown";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FeatureExtractor(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    FeatureExtractor(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Parse and extract a JSON payload.
     *
     * @throws MalformedReadingException if the payload is not a JSON object or a field is malformed
     */
    public SensorReading parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedReadingException("Empty payload");
        }
        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedReadingException("Unparseable JSON: " + e.getOriginalMessage(), e);
        }
        return extract(message);
    }

    /**
     * Extract a reading from a parsed message.
     *
     * @throws MalformedReadingException if a feature field cannot be coerced to a finite number
     */
    public SensorReading extract(JsonNode message) {
        if (message == null || !message.isObject()) {
            throw new MalformedReadingException("Message is not a JSON object");
        }

        Map<SensorFeature, Double> values = new EnumMap<>(SensorFeature.class);
        for (SensorFeature feature : SensorFeature.ordered()) {
            JsonNode field = lookup(message, feature);
            if (field != null) {
                values.put(feature, coerce(feature, field));
            }
        }

        String timestamp = textOrNull(message.get(FIELD_TIMESTAMP));
        if (timestamp == null) {
            timestamp = Instant.now(clock).toString();
        }
        String machineId = textOrNull(message.get(FIELD_MACHINE_ID));
        if (machineId == null) {
            machineId = UNKNOWN_MACHINE;
        }

        return new SensorReading(timestamp, machineId, FeatureVector.of(values));
    }

    private JsonNode lookup(JsonNode message, SensorFeature feature) {
        JsonNode node = message.get(feature.fieldName());
        if (node == null || node.isNull()) {
            for (String alias : feature.aliases()) {
                JsonNode aliased = message.get(alias);
                if (aliased != null && !aliased.isNull()) {
                    return aliased;
                }
            }
            return null;
        }
        return node;
    }

    private double coerce(SensorFeature feature, JsonNode field) {
        double value;
        if (field.isNumber()) {
            value = field.doubleValue();
        } else if (field.isTextual()) {
            try {
                value = Double.parseDouble(field.textValue().trim());
            } catch (NumberFormatException e) {
                throw new MalformedReadingException("Field '" + feature.fieldName()
                        + "' is not numeric: " + field.textValue(), e);
            }
        } else {
            throw new MalformedReadingException("Field '" + feature.fieldName()
                    + "' has unsupported type " + field.getNodeType());
        }
        if (!Double.isFinite(value)) {
            throw new MalformedReadingException("Field '" + feature.fieldName() + "' is not finite: " + value);
        }
        return value;
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
