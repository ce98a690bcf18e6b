package com.prediction.market.settlement_engine.entity;

public enum PendingDebitStatus {
    /** Awaiting reversal. */
    OPEN,
    /** Debit confirmed and refunded. */
    REVERSED,
    /** Debit never took effect; nothing to refund. */
    CLEARED
}
