package com.prediction.market.settlement_engine.exception;

public class InvalidBetException extends SettlementException {

    public InvalidBetException(String reason) {
        super(ErrorKind.VALIDATION, "INVALID_BET", reason);
    }
}
