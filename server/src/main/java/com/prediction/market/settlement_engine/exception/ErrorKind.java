package com.prediction.market.settlement_engine.exception;

/**
 * Failure classes a caller can act on.
 */
public enum ErrorKind {
    /** Bad input; retry with corrected input. */
    VALIDATION,
    /** Market/bet is in the wrong state; not retryable as-is. */
    STATE_CONFLICT,
    /** Missing funds; retryable after funding. */
    RESOURCE,
    /** Wallet or store did not answer in time; retry with the returned token. */
    DEPENDENCY,
    NOT_FOUND,
    AUTHORIZATION
}
