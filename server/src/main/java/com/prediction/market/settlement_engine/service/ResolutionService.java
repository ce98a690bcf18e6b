package com.prediction.market.settlement_engine.service;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.MarketStatus;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.AlreadyResolvedException;
import com.prediction.market.settlement_engine.exception.InvalidResolutionException;
import com.prediction.market.settlement_engine.exception.MarketNotFoundException;
import com.prediction.market.settlement_engine.execution.MarketExecutionRegistry;
import com.prediction.market.settlement_engine.store.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a market from OPEN to RESOLVED exactly once.
 *
 * Runs on the market's executor, so it is ordered after every bet queued
 * before it. Payouts are not computed here; claims do that per bet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionService {

    private final MarketExecutionRegistry executionRegistry;
    private final MarketStore marketStore;
    private final LedgerStore ledgerStore;
    private final Clock clock;

    public Market resolve(String marketId, Side outcome, String note) {
        if (outcome == null) {
            throw new InvalidResolutionException(marketId, "outcome is required (YES or NO)");
        }
        Market current = marketStore.getMarket(marketId);
        if (current == null) {
            throw new MarketNotFoundException(marketId);
        }
        if (current.isResolved()) {
            throw new AlreadyResolvedException(marketId, current.getOutcome());
        }
        try {
            return executionRegistry.execute(marketId, () -> doResolve(marketId, outcome, note));
        } finally {
            releaseIfResolved(marketId);
        }
    }

    /**
     * RESOLVED is terminal and claims do not run on the market's executor.
     */
    private void releaseIfResolved(String marketId) {
        Market market = marketStore.getMarket(marketId);
        if (market != null && market.isResolved()) {
            executionRegistry.release(marketId);
        }
    }

    private Market doResolve(String marketId, Side outcome, String note) {
        Market market = marketStore.getMarket(marketId);
        if (market == null) {
            throw new MarketNotFoundException(marketId);
        }
        if (market.isResolved()) {
            throw new AlreadyResolvedException(marketId, market.getOutcome());
        }

        long now = clock.millis();
        long betsFlagged;
        try {
            betsFlagged = ledgerStore.inTransaction(() -> {
                if (!ledgerStore.markResolved(marketId, outcome, note, now)) {
                    throw new AlreadyResolvedException(marketId, null);
                }
                return ledgerStore.markBetsResolved(marketId);
            });
        } catch (AlreadyResolvedException e) {
            // resolved by another process; reload on next access
            marketStore.evict(marketId);
            log.warn("Resolution lost to a concurrent resolver marketId={}", marketId);
            throw e;
        }

        Market resolved = market.toBuilder()
                .status(MarketStatus.RESOLVED)
                .outcome(outcome)
                .resolutionNote(note)
                .resolvedAt(now)
                .updatedAt(now)
                .build();
        marketStore.put(resolved);

        log.info("Market resolved: marketId={} outcome={} bets={} yesPool={} noPool={}",
                marketId, outcome, betsFlagged, resolved.getYesPool(), resolved.getNoPool());
        return resolved;
    }
}
