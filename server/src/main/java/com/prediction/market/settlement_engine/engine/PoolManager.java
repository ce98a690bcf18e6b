package com.prediction.market.settlement_engine.engine;

import java.math.BigDecimal;
import java.time.Clock;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.ConcurrentMarketUpdateException;
import com.prediction.market.settlement_engine.exception.MarketNotFoundException;
import com.prediction.market.settlement_engine.store.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns every read and write of market pools.
 *
 * applyStake must run on the market's executor inside a ledger transaction;
 * the caller publishes the returned state once the transaction commits.
 */
@Slf4j
@RequiredArgsConstructor
public class PoolManager {
    private final MarketStore marketStore;
    private final LedgerStore ledgerStore;
    private final PricingEngine pricingEngine;
    private final Clock clock;

    public BigDecimal currentPrice(String marketId, Side side) {
        return pricingEngine.price(side, pools(marketId));
    }

    public PoolState pools(String marketId) {
        return PoolState.of(requireMarket(marketId));
    }

    /**
     * Writes the staked pool state through a compare-and-set on the cached revision.
     * Does not touch the cache; see {@link #publish} and {@link #invalidate}.
     */
    public PoolState applyStake(String marketId, Side side, Money netStake, Money grossAmount) {
        PoolState current = pools(marketId);
        PoolState next = pricingEngine.applyStake(current, side, netStake, grossAmount);

        boolean applied = ledgerStore.compareAndSetPools(marketId, current.revision(), next, clock.millis());
        if (!applied) {
            log.warn("Pool CAS lost marketId={} expectedRevision={}", marketId, current.revision());
            marketStore.evict(marketId);
            throw new ConcurrentMarketUpdateException(marketId, current.revision());
        }
        return next;
    }

    public void publish(String marketId, PoolState committed) {
        marketStore.applyPoolState(marketId, committed, clock.millis());
    }

    public void invalidate(String marketId) {
        marketStore.evict(marketId);
    }

    private Market requireMarket(String marketId) {
        Market market = marketStore.getMarket(marketId);
        if (market == null) {
            throw new MarketNotFoundException(marketId);
        }
        return market;
    }
}
