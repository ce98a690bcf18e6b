package com.prediction.market.settlement_engine.cache;

import java.util.concurrent.ConcurrentHashMap;

import com.prediction.market.settlement_engine.engine.PoolState;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.store.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process view of markets, loaded lazily from the ledger store.
 *
 * Entries are immutable snapshots of committed state; writers replace them
 * after commit and evict them on failure.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketStore {
    private final ConcurrentHashMap<String, Market> markets = new ConcurrentHashMap<>();
    private final LedgerStore ledgerStore;

    /**
     * Cached market, loaded on first access. Null if it does not exist.
     */
    public Market getMarket(String marketId) {
        return markets.computeIfAbsent(marketId, id -> ledgerStore.findMarket(id)
                .map(market -> {
                    log.debug("Loaded market into cache marketId={} revision={}", id, market.getRevision());
                    return market;
                })
                .orElse(null));
    }

    public void put(Market market) {
        markets.put(market.getId(), market);
    }

    /**
     * Replaces the cached snapshot with one carrying the committed pool state.
     */
    public void applyPoolState(String marketId, PoolState pools, long updatedAt) {
        markets.computeIfPresent(marketId, (id, market) -> market.toBuilder()
                .yesPool(pools.yesPool().toBigDecimal())
                .noPool(pools.noPool().toBigDecimal())
                .totalVolume(pools.totalVolume().toBigDecimal())
                .revision(pools.revision())
                .updatedAt(updatedAt)
                .build());
    }

    public void evict(String marketId) {
        if (markets.remove(marketId) != null) {
            log.debug("Evicted market from cache marketId={}", marketId);
        }
    }
}
