package com.prediction.market.settlement_engine.exception;

import com.prediction.market.settlement_engine.entity.Money;

/**
 * The gross amount is swallowed entirely by fees.
 */
public class AmountTooSmallException extends SettlementException {

    public AmountTooSmallException(Money grossAmount, Money netStake) {
        super(ErrorKind.VALIDATION, "AMOUNT_TOO_SMALL",
                String.format("Amount %s leaves net stake %s after fees", grossAmount, netStake));
    }
}
