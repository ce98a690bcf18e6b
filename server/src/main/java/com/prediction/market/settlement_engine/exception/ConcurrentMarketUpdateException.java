package com.prediction.market.settlement_engine.exception;

/**
 * The pool compare-and-set lost against a writer in another process.
 * No pool or balance change was kept; the bet can be placed again.
 */
public class ConcurrentMarketUpdateException extends SettlementException {

    public ConcurrentMarketUpdateException(String marketId, long expectedRevision) {
        super(ErrorKind.STATE_CONFLICT, "MARKET_BUSY",
                String.format("Market %s changed concurrently (expected revision %d)", marketId, expectedRevision));
    }
}
