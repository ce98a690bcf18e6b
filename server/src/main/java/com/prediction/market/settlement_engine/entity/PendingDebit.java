package com.prediction.market.settlement_engine.entity;

import java.math.BigDecimal;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A wallet debit that may have been applied while its bet never committed.
 * Keyed by the debit's idempotency key; the recovery job replays the debit
 * with that key and refunds whatever it confirms.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "pending_debits")
@CompoundIndex(name = "status_created_idx", def = "{'status':1,'createdAt':1}")
public class PendingDebit {

    @MongoId
    private String key;

    private String betId;
    private String userId;
    private String marketId;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal amount;

    @Builder.Default
    private PendingDebitStatus status = PendingDebitStatus.OPEN;

    private String reason;
    private long createdAt;
    private Long closedAt;
}
