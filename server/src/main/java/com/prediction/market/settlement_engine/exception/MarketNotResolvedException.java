package com.prediction.market.settlement_engine.exception;

public class MarketNotResolvedException extends SettlementException {

    public MarketNotResolvedException(String marketId) {
        super(ErrorKind.STATE_CONFLICT, "NOT_RESOLVED", "Market is not resolved yet: " + marketId);
    }
}
