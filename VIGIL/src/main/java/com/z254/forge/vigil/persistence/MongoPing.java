package com.z254.forge.vigil.persistence;

import org.bson.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;

final class MongoPing {

    private MongoPing() {
    }

    static void ping(MongoTemplate mongoTemplate) {
        Document reply = mongoTemplate.executeCommand("{ ping: 1 }");
        Object ok = reply.get("ok");
        if (!(ok instanceof Number) || ((Number) ok).doubleValue() != 1.0) {
            throw new DataAccessResourceFailureException("MongoDB ping failed: " + reply.toJson());
        }
    }
}
