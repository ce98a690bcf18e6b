package com.prediction.market.settlement_engine.exception;

import com.prediction.market.settlement_engine.entity.Money;

public class InsufficientFundsException extends SettlementException {

    public InsufficientFundsException(String userId, Money required, Money available) {
        super(ErrorKind.RESOURCE, "INSUFFICIENT_FUNDS",
                available == null
                        ? String.format("Insufficient balance for user %s: need %s", userId, required)
                        : String.format("Insufficient balance for user %s: have %s, need %s", userId, available, required));
    }
}
