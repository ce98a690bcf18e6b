package com.prediction.market.settlement_engine;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;

class MongoStartUpCheckTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class, RETURNS_DEEP_STUBS);

    @Test
    void passesWhenTheStoreAnswers() {
        when(mongoTemplate.executeCommand(any(Document.class))).thenReturn(new Document("setName", "rs0"));
        when(mongoTemplate.getDb().getName()).thenReturn("settlement");

        assertThatCode(() -> new MongoStartUpCheck(mongoTemplate).checkMongoConnection()).doesNotThrowAnyException();
    }

    @Test
    void failsStartupWhenTheStoreIsDown() {
        when(mongoTemplate.executeCommand(any(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> new MongoStartUpCheck(mongoTemplate).checkMongoConnection())
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
