package com.prediction.market.settlement_engine.entity;

/**
 * Market lifecycle.
 *
 * OPEN → RESOLVED (one-way; RESOLVED is terminal)
 *
 * An OPEN market past its end date is closed for betting but still OPEN
 * until an administrator resolves it.
 */
public enum MarketStatus {

    /**
     * Accepting bets until endDate. Pools may grow.
     */
    OPEN,

    /**
     * Outcome recorded. Pools are frozen and bets are claimable.
     * TERMINAL STATE.
     */
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    public boolean canTransitionTo(MarketStatus to) {
        return this == OPEN && to == RESOLVED;
    }
}
