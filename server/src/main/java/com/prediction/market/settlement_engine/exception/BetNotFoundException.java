package com.prediction.market.settlement_engine.exception;

public class BetNotFoundException extends SettlementException {

    public BetNotFoundException(String betId) {
        super(ErrorKind.NOT_FOUND, "BET_NOT_FOUND", "Bet not found: " + betId);
    }
}
