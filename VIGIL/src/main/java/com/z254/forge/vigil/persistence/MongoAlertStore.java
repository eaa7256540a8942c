package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AlertRecord;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Alert records as documents of one MongoDB collection.
 */
@Slf4j
public class MongoAlertStore implements AlertStore {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoAlertStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
    }

    @Override
    @CircuitBreaker(name = "alert-store")
    public void save(AlertRecord record) {
        mongoTemplate.insert(record, collection);
        log.debug("Alert record stored: machineId={}, alerts={}", record.getMachineId(), record.getAlerts().size());
    }

    @Override
    public void verifyConnection() {
        MongoPing.ping(mongoTemplate);
    }
}
