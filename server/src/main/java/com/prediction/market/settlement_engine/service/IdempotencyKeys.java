package com.prediction.market.settlement_engine.service;

/**
 * Wallet idempotency keys. Each is derived from the bet id, so every retry of
 * the same operation, from any process, carries the same key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String debit(String betId) {
        return "bet:" + betId + ":debit";
    }

    public static String refund(String betId) {
        return "bet:" + betId + ":refund";
    }

    public static String payout(String betId) {
        return "bet:" + betId + ":payout";
    }

    public static String platformFee(String betId) {
        return "bet:" + betId + ":platform-fee";
    }

    public static String creatorFee(String betId) {
        return "bet:" + betId + ":creator-fee";
    }

    public static String deposit(String reference) {
        return "deposit:" + reference;
    }
}
