package com.z254.forge.vigil.config;

import com.z254.forge.vigil.stream.KafkaSensorFeed;
import com.z254.forge.vigil.stream.SensorFeed;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for the sensor stream consumer.
 * <p>
 * Provides:
 * <ul>
 *     <li>String consumer factory for JSON sensor payloads</li>
 *     <li>The {@link SensorFeed} polled by the ingestion loop</li>
 * </ul>
 */
@Configuration
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final VigilProperties vigilProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, VigilProperties vigilProperties) {
        this.kafkaProperties = kafkaProperties;
        this.vigilProperties = vigilProperties;
    }

    /**
     * Consumer factory with String key and value deserializers.
     */
    @Bean
    public ConsumerFactory<String, String> sensorConsumerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildConsumerProperties(null));

        props.put(ConsumerConfig.GROUP_ID_CONFIG, vigilProperties.getKafka().getGroupId());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Live feed: a fresh group starts at the head, offsets committed as consumed
        props.putIfAbsent(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.putIfAbsent(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);

        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public SensorFeed sensorFeed(ConsumerFactory<String, String> sensorConsumerFactory) {
        return new KafkaSensorFeed(sensorConsumerFactory,
                vigilProperties.getKafka().getSensorTopic(),
                vigilProperties.getIngestion().getConnectTimeout());
    }
}
