package com.prediction.market.settlement_engine;

import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails startup when the ledger store is unreachable. Bet commits and
 * resolutions run in multi-document transactions, which need a replica set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoStartUpCheck {

    private final MongoTemplate mongoTemplate;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            Document hello = mongoTemplate.executeCommand(new Document("hello", 1));
            if (hello.getString("setName") == null) {
                log.warn("MongoDB is not a replica set member; ledger transactions will fail db={}",
                        mongoTemplate.getDb().getName());
            } else {
                log.info("MongoDB connection successful db={} replicaSet={}",
                        mongoTemplate.getDb().getName(), hello.getString("setName"));
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
