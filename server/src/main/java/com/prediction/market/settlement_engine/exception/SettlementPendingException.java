package com.prediction.market.settlement_engine.exception;

/**
 * A wallet call may or may not have taken effect. The engine has recorded the
 * operation for recovery; the retry token is the idempotency key to re-drive it.
 */
public class SettlementPendingException extends SettlementException {

    private final String reference;
    private final String retryToken;

    public SettlementPendingException(String reference, String retryToken, Throwable cause) {
        super(ErrorKind.DEPENDENCY, "SETTLEMENT_PENDING",
                String.format("Settlement of %s is pending; retry with token %s", reference, retryToken), cause);
        this.reference = reference;
        this.retryToken = retryToken;
    }

    public String getReference() {
        return reference;
    }

    public String getRetryToken() {
        return retryToken;
    }
}
