package com.prediction.market.settlement_engine.exception;

/**
 * Wallet call timed out or kept failing after bounded retries.
 */
public class WalletUnavailableException extends SettlementException {

    private final String operation;
    private final String idempotencyKey;

    public WalletUnavailableException(String operation, String idempotencyKey, Throwable cause) {
        super(ErrorKind.DEPENDENCY, "WALLET_UNAVAILABLE",
                String.format("Wallet %s failed (key=%s): %s", operation, idempotencyKey,
                        cause == null ? "unknown" : cause.toString()),
                cause);
        this.operation = operation;
        this.idempotencyKey = idempotencyKey;
    }

    public String getOperation() {
        return operation;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
