package com.prediction.market.settlement_engine.exception;

public class MarketNotFoundException extends SettlementException {

    public MarketNotFoundException(String marketId) {
        super(ErrorKind.NOT_FOUND, "MARKET_NOT_FOUND", "Market not found: " + marketId);
    }
}
