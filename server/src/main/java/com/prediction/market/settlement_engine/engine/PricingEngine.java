package com.prediction.market.settlement_engine.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;

/**
 * Parimutuel pricing over the two pools of a binary market.
 * Stateless; all arithmetic is BigDecimal.
 */
public class PricingEngine {

    public static final int PRICE_SCALE = 8;
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    public static final BigDecimal MIN_PRICE = new BigDecimal("0.00000001");
    public static final BigDecimal MAX_PRICE = BigDecimal.ONE.subtract(MIN_PRICE);

    // Implied price of YES: yesPool / (yesPool + noPool), clamped inside (0,1).
    public BigDecimal yesPrice(Money yesPool, Money noPool) {
        if (!yesPool.isPositive() || !noPool.isPositive()) {
            throw new IllegalStateException(
                    String.format("Pools must be positive: yes=%s no=%s", yesPool, noPool));
        }
        BigDecimal total = yesPool.toBigDecimal().add(noPool.toBigDecimal());
        BigDecimal raw = yesPool.toBigDecimal().divide(total, PRICE_SCALE, ROUNDING_MODE);
        return raw.max(MIN_PRICE).min(MAX_PRICE);
    }

    // NO is the exact complement of YES so the two always sum to one.
    public BigDecimal price(Side side, Money yesPool, Money noPool) {
        BigDecimal yes = yesPrice(yesPool, noPool);
        return side == Side.YES ? yes : BigDecimal.ONE.subtract(yes);
    }

    public BigDecimal price(Side side, PoolState pools) {
        return price(side, pools.yesPool(), pools.noPool());
    }

    // Decimal odds: 1 / price
    public BigDecimal odds(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        return BigDecimal.ONE.divide(price, PRICE_SCALE, ROUNDING_MODE);
    }

    /**
     * Adds the net stake to the chosen side's pool and the gross amount to the volume.
     * The opposite pool is untouched.
     */
    public PoolState applyStake(PoolState current, Side side, Money netStake, Money grossAmount) {
        if (!netStake.isPositive()) {
            throw new IllegalArgumentException("Net stake must be positive: " + netStake);
        }
        Money yes = side == Side.YES ? current.yesPool().add(netStake) : current.yesPool();
        Money no = side == Side.NO ? current.noPool().add(netStake) : current.noPool();
        return new PoolState(yes, no, current.totalVolume().add(grossAmount), current.revision() + 1);
    }

    /**
     * Locked-odds payout of a winning bet: netStake / price, rounded to cents.
     */
    public Money payout(Money netStake, BigDecimal lockedPrice) {
        if (lockedPrice == null || lockedPrice.signum() <= 0) {
            throw new IllegalArgumentException("Locked price must be positive: " + lockedPrice);
        }
        return netStake.divide(lockedPrice);
    }
}
