package com.prediction.market.settlement_engine.exception;

public class InvalidResolutionException extends SettlementException {

    public InvalidResolutionException(String marketId, String reason) {
        super(ErrorKind.VALIDATION, "INVALID_RESOLUTION",
                String.format("Cannot resolve market %s: %s", marketId, reason));
    }
}
