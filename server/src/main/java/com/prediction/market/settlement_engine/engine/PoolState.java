package com.prediction.market.settlement_engine.engine;

import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;

/**
 * Immutable pool snapshot of one market, guarded by {@code revision}.
 */
public record PoolState(Money yesPool, Money noPool, Money totalVolume, long revision) {

    public static PoolState of(Market market) {
        return new PoolState(
                Money.ofNullable(market.getYesPool()),
                Money.ofNullable(market.getNoPool()),
                Money.ofNullable(market.getTotalVolume()),
                market.getRevision());
    }

    public Money total() {
        return yesPool.add(noPool);
    }
}
