package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.Side;

/**
 * Read-only preview of a bet at the current pool state. Nothing is reserved;
 * the executed bet may lock a different price.
 */
public record BetQuote(
        String marketId,
        Side side,
        BigDecimal grossAmount,
        BigDecimal price,
        BigDecimal odds,
        BigDecimal platformFee,
        BigDecimal creatorFee,
        BigDecimal netStake,
        BigDecimal potentialPayout) {
}
