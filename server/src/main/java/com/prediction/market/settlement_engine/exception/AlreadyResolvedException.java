package com.prediction.market.settlement_engine.exception;

import com.prediction.market.settlement_engine.entity.Side;

public class AlreadyResolvedException extends SettlementException {

    private final Side outcome;

    public AlreadyResolvedException(String marketId, Side outcome) {
        super(ErrorKind.STATE_CONFLICT, "ALREADY_RESOLVED",
                String.format("Market %s is already resolved%s", marketId, outcome == null ? "" : " to " + outcome));
        this.outcome = outcome;
    }

    public Side getOutcome() {
        return outcome;
    }
}
