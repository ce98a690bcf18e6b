package com.prediction.market.settlement_engine.wallet;

public enum CreditResult {
    /** Applied. */
    OK,
    /** Accepted but not yet final (e.g. an on-chain transfer awaiting confirmation). */
    PENDING,
    /** Rejected; safe to retry with the same key. */
    FAILED
}
