package com.prediction.market.settlement_engine.entity;

/**
 * State of an outbound credit (payout or fee routing) tied to a bet.
 *
 * State Transitions:
 *
 * PENDING → SENT       (wallet accepted the credit, confirmation outstanding)
 * PENDING → CONFIRMED  (wallet applied the credit)
 * PENDING → FAILED     (wallet rejected or could not be reached)
 * PENDING → NOT_REQUIRED (fee routing with zero fees)
 *
 * SENT → CONFIRMED
 * SENT → FAILED
 *
 * FAILED → PENDING     (retry picked up; same idempotency key is reused)
 *
 * Terminal states: CONFIRMED, NOT_REQUIRED
 */
public enum TransferStatus {

    /**
     * Nothing to transfer (losing bet, zero fees).
     * TERMINAL STATE.
     */
    NOT_REQUIRED,

    /**
     * Recorded before the wallet call. A crash here leaves the bet for recovery.
     */
    PENDING,

    /**
     * Wallet accepted the request but has not confirmed it.
     */
    SENT,

    /**
     * Credit applied.
     * TERMINAL STATE.
     */
    CONFIRMED,

    /**
     * Last attempt failed; retryable with the stored key.
     */
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == NOT_REQUIRED;
    }

    /**
     * Statuses that the recovery job and the retry endpoint may re-drive.
     */
    public boolean isRetryable() {
        return this == PENDING || this == SENT || this == FAILED;
    }

    public boolean canTransitionTo(TransferStatus to) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> to == SENT || to == CONFIRMED || to == FAILED || to == NOT_REQUIRED;
            case SENT -> to == CONFIRMED || to == FAILED;
            case FAILED -> to == PENDING;
            default -> false;
        };
    }
}
