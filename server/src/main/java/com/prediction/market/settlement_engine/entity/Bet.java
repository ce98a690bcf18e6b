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
 * A single executed bet.
 *
 * Created only by BetExecutionService and never deleted. The execution fields
 * (amounts, side, locked price) are immutable. Later writes are limited to:
 * - resolved: set by ResolutionService together with the market status
 * - payout/claimed/transfer*: set once by ClaimService through a CAS on claimed=false
 * - feeStatus: advanced by FeeDistributionService
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "bets")
// partial, not sparse: a sparse compound index still keys nonce-less bets as {userId, null}
@CompoundIndex(name = "user_nonce_partial_idx", def = "{'userId':1,'nonce':1}", unique = true,
        partialFilter = "{ 'nonce': { '$exists': true } }")
@CompoundIndex(name = "market_created_idx", def = "{'marketId':1,'createdAt':-1}")
@CompoundIndex(name = "user_created_idx", def = "{'userId':1,'createdAt':-1}")
@CompoundIndex(name = "transfer_status_idx", def = "{'transferStatus':1,'transferUpdatedAt':1}")
public class Bet {

    @MongoId
    private String id;

    @Indexed
    private String marketId;

    private String userId;

    private Side side;

    /**
     * What the user authorized; debited in full.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal grossAmount;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal platformFee;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal creatorFee;

    /**
     * grossAmount - platformFee - creatorFee; the amount added to the pool.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal netStake;

    /**
     * Implied price of {@link #side} at execution time (scale 8). Locked forever.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal price;

    /**
     * Optional client nonce; a replayed request returns the original bet.
     */
    private String nonce;

    private long createdAt;

    @Builder.Default
    private boolean resolved = false;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal payout; // null until claimed

    @Builder.Default
    private boolean claimed = false;

    private Long claimedAt;

    private TransferStatus transferStatus; // null until claimed

    /**
     * Idempotency key of the payout credit; also handed to clients as the retry token.
     */
    private String transferKey;

    private String transferError;
    private Long transferUpdatedAt;

    @Setter
    private TransferStatus feeStatus;
    private Long feeUpdatedAt;

    public Money grossMoney() {
        return Money.of(grossAmount);
    }

    public Money netStakeMoney() {
        return Money.of(netStake);
    }

    public boolean isWinningFor(Side outcome) {
        return outcome != null && side == outcome;
    }
}
