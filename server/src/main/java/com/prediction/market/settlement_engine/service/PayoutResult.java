package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;

/**
 * Outcome of a claim. transferKey doubles as the retry token.
 */
public record PayoutResult(
        String betId,
        String marketId,
        Side side,
        Side outcome,
        boolean won,
        BigDecimal payout,
        TransferStatus transferStatus,
        String transferKey) {
}
