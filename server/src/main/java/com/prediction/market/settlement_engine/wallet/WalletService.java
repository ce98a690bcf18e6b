package com.prediction.market.settlement_engine.wallet;

import com.prediction.market.settlement_engine.entity.Money;

/**
 * Custody boundary. Implementations must be idempotent per key: repeating a
 * debit or credit with a key that was already applied returns the original
 * outcome without moving funds again.
 */
public interface WalletService {

    Money availableBalance(String userId);

    DebitResult debit(String userId, Money amount, String idempotencyKey);

    CreditResult credit(String userId, Money amount, String idempotencyKey);
}
