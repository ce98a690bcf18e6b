package com.prediction.market.settlement_engine.exception;

public class AlreadyClaimedException extends SettlementException {

    public AlreadyClaimedException(String betId) {
        super(ErrorKind.STATE_CONFLICT, "ALREADY_CLAIMED", "Bet already claimed: " + betId);
    }
}
