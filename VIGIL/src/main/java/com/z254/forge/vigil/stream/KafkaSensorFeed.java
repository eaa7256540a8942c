package com.z254.forge.vigil.stream;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sensor feed over a Kafka topic. Records are keyed by machine id, so messages of one
 * machine arrive in order.
 */
@Slf4j
public class KafkaSensorFeed implements SensorFeed {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final ConsumerFactory<String, String> consumerFactory;
    private final String topic;
    private final Duration connectTimeout;

    public KafkaSensorFeed(ConsumerFactory<String, String> consumerFactory, String topic, Duration connectTimeout) {
        this.consumerFactory = consumerFactory;
        this.topic = topic;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public SensorSubscription subscribe() throws FeedConnectionException {
        Consumer<String, String> consumer = consumerFactory.createConsumer();
        try {
            // Fails fast when no broker answers within the timeout
            List<PartitionInfo> partitions = consumer.partitionsFor(topic, connectTimeout);
            if (partitions == null || partitions.isEmpty()) {
                throw new FeedConnectionException("Topic " + topic + " has no partitions");
            }
            consumer.subscribe(List.of(topic));
            log.debug("Subscribed to {} ({} partitions)", topic, partitions.size());
            return new KafkaSubscription(consumer);
        } catch (KafkaException e) {
            closeQuietly(consumer);
            throw new FeedConnectionException("Cannot subscribe to " + topic + ": " + e.getMessage(), e);
        } catch (FeedConnectionException e) {
            closeQuietly(consumer);
            throw e;
        }
    }

    @Override
    public String channel() {
        return topic;
    }

    private static void closeQuietly(Consumer<String, String> consumer) {
        try {
            consumer.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            log.debug("Error closing Kafka consumer: {}", e.getMessage());
        }
    }

    private static final class KafkaSubscription implements SensorSubscription {

        private final Consumer<String, String> consumer;

        private KafkaSubscription(Consumer<String, String> consumer) {
            this.consumer = consumer;
        }

        @Override
        public List<String> poll(Duration timeout) throws FeedConnectionException {
            ConsumerRecords<String, String> records;
            try {
                records = consumer.poll(timeout);
            } catch (WakeupException e) {
                return List.of();
            } catch (KafkaException e) {
                throw new FeedConnectionException("Kafka poll failed: " + e.getMessage(), e);
            }
            List<String> payloads = new ArrayList<>(records.count());
            for (ConsumerRecord<String, String> record : records) {
                payloads.add(record.value());
            }
            return payloads;
        }

        @Override
        public void wakeup() {
            consumer.wakeup();
        }

        @Override
        public void close() {
            closeQuietly(consumer);
        }
    }
}
