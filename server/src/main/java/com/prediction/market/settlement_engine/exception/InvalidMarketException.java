package com.prediction.market.settlement_engine.exception;

/**
 * Rejected market definition or fee override.
 */
public class InvalidMarketException extends SettlementException {

    public InvalidMarketException(String reason) {
        super(ErrorKind.VALIDATION, "INVALID_MARKET", reason);
    }
}
