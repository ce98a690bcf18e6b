package com.prediction.market.settlement_engine.exception;

public class MarketClosedException extends SettlementException {

    private final String marketId;

    public MarketClosedException(String marketId, String reason) {
        super(ErrorKind.STATE_CONFLICT, "MARKET_CLOSED",
                String.format("Market %s is not accepting bets: %s", marketId, reason));
        this.marketId = marketId;
    }

    public String getMarketId() {
        return marketId;
    }
}
