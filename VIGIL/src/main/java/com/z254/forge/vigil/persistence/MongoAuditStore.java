package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AuditRecord;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Audit records as documents of one MongoDB collection.
 */
public class MongoAuditStore implements AuditStore {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoAuditStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
    }

    @Override
    @CircuitBreaker(name = "audit-store")
    public void save(AuditRecord record) {
        mongoTemplate.insert(record, collection);
    }

    @Override
    public void verifyConnection() {
        MongoPing.ping(mongoTemplate);
    }
}
