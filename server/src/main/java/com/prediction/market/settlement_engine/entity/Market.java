package com.prediction.market.settlement_engine.entity;

import java.math.BigDecimal;

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
 * A binary-outcome market and its two-sided pool state.
 *
 * Pools start at the seed liquidity and only grow while OPEN. Prices are
 * derived from the pools (see PricingEngine) and never stored. The cached copy
 * held by MarketStore is replaced, never mutated, so treat instances obtained
 * from the cache as read-only and use toBuilder() to derive a new snapshot.
 */
@Document(collection = "markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Market {
    @MongoId
    private String id;

    private String title;
    private String categoryId;
    private String creatorId;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal seedLiquidity;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal yesPool;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal noPool;

    // gross, pre-fee
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal totalVolume;

    @Indexed
    @Builder.Default
    private MarketStatus status = MarketStatus.OPEN;

    private Side outcome; // null while OPEN
    private long endDate;
    private Long resolvedAt;
    private String resolutionNote;

    /**
     * Optional per-market fee overrides; null falls back to configured defaults.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal platformFeeRate;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal creatorFeeRate;

    /**
     * Bumped on every pool or fee write; the compare-and-set guard for pool updates.
     */
    private long revision;

    private long createdAt;
    private long updatedAt;

    public boolean isOpen() {
        return status == MarketStatus.OPEN;
    }

    public boolean isResolved() {
        return status == MarketStatus.RESOLVED;
    }
}
