package com.prediction.market.settlement_engine.exception;

/**
 * Base class of every rejection raised by the settlement engine.
 * Each subclass carries a stable code so callers can branch without parsing messages.
 */
public abstract class SettlementException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    protected SettlementException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    protected SettlementException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
