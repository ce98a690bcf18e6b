package com.prediction.market.settlement_engine.engine;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.Money;

/**
 * Split of a gross bet amount. grossAmount == platformFee + creatorFee + netStake.
 */
public record FeeBreakdown(
        Money grossAmount,
        Money platformFee,
        Money creatorFee,
        Money netStake,
        BigDecimal platformFeeRate,
        BigDecimal creatorFeeRate) {

    public Money totalFees() {
        return platformFee.add(creatorFee);
    }
}
