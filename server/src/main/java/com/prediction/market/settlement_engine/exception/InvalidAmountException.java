package com.prediction.market.settlement_engine.exception;

import java.math.BigDecimal;

public class InvalidAmountException extends SettlementException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount, String reason) {
        super(ErrorKind.VALIDATION, "INVALID_AMOUNT",
                String.format("Invalid amount %s: %s", amount == null ? "null" : amount.toPlainString(), reason));
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
