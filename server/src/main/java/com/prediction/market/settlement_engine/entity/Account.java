package com.prediction.market.settlement_engine.entity;

import java.math.BigDecimal;

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
 * Spendable balance of a user, platform or creator account in the bundled wallet.
 * Only changed by LedgerWalletService, always together with a ledger entry.
 */
@Document(collection = "accounts")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Account {
    @MongoId
    private String userId;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal balance;

    private long updatedAt;

    public Money balanceMoney() {
        return Money.ofNullable(balance);
    }
}
