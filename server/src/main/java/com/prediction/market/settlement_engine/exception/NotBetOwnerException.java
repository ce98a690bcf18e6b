package com.prediction.market.settlement_engine.exception;

public class NotBetOwnerException extends SettlementException {

    public NotBetOwnerException(String betId, String requesterId) {
        super(ErrorKind.AUTHORIZATION, "FORBIDDEN",
                String.format("Bet %s does not belong to %s", betId, requesterId));
    }
}
