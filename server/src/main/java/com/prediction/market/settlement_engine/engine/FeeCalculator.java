package com.prediction.market.settlement_engine.engine;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;

import lombok.Getter;

/**
 * Computes platform and creator fees. A market's own rates override the defaults.
 */
@Getter
public class FeeCalculator {

    private final BigDecimal defaultPlatformFeeRate;
    private final BigDecimal defaultCreatorFeeRate;

    public FeeCalculator(BigDecimal defaultPlatformFeeRate, BigDecimal defaultCreatorFeeRate) {
        validateRates(defaultPlatformFeeRate, defaultCreatorFeeRate);
        this.defaultPlatformFeeRate = defaultPlatformFeeRate;
        this.defaultCreatorFeeRate = defaultCreatorFeeRate;
    }

    public FeeBreakdown calculate(Market market, Money grossAmount) {
        BigDecimal platformRate = market.getPlatformFeeRate() != null
                ? market.getPlatformFeeRate()
                : defaultPlatformFeeRate;
        BigDecimal creatorRate = market.getCreatorFeeRate() != null
                ? market.getCreatorFeeRate()
                : defaultCreatorFeeRate;
        return calculate(grossAmount, platformRate, creatorRate);
    }

    public FeeBreakdown calculate(Money grossAmount, BigDecimal platformRate, BigDecimal creatorRate) {
        Money platformFee = grossAmount.multiply(platformRate);
        Money creatorFee = grossAmount.multiply(creatorRate);
        Money netStake = grossAmount.subtract(platformFee).subtract(creatorFee);
        return new FeeBreakdown(grossAmount, platformFee, creatorFee, netStake, platformRate, creatorRate);
    }

    /**
     * Each rate in [0,1) and together below 1, otherwise no stake would reach the pool.
     */
    public static void validateRates(BigDecimal platformRate, BigDecimal creatorRate) {
        checkRate("platform", platformRate);
        checkRate("creator", creatorRate);
        if (platformRate.add(creatorRate).compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException(
                    String.format("Fee rates must sum below 1: platform=%s creator=%s", platformRate, creatorRate));
        }
    }

    private static void checkRate(String name, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException(name + " fee rate must be in [0,1): " + rate);
        }
    }
}
