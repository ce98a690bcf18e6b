package com.prediction.market.settlement_engine.entity;

import java.math.BigDecimal;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
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
 * Append-only wallet ledger entry. The sum of a user's entries is the
 * authoritative balance; Account.balance must always agree with it.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "transactions")
@CompoundIndex(name = "user_timestamp_idx", def = "{'userId':1,'timestamp':-1}")
public class Transaction {
    @MongoId
    private String id;

    @Indexed
    private String userId;

    private String transactionType; // DEBIT, CREDIT

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal amount; // positive for credit, negative for debit

    private long timestamp;

    /**
     * Idempotency key of the wallet call that produced this entry, e.g.
     * bet:{betId}:payout. The unique index makes each key apply at most once.
     */
    @Indexed(unique = true)
    private String nonce;

    @Builder.Default
    private String status = "COMPLETED";

    /**
     * Running balance after this entry: balanceBefore + amount.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal balanceAfter;
}
