package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.exception.InvalidAmountException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.wallet.CreditResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Balance lookups and administrative deposits through the wallet gateway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final WalletGateway walletGateway;

    public Money balance(String userId) {
        return walletGateway.availableBalance(userId);
    }

    /**
     * Credits the account once per reference; repeating a reference is a no-op.
     */
    public CreditResult deposit(String userId, BigDecimal amount, String reference) {
        if (amount == null || amount.signum() <= 0 || !Money.isExact(amount)) {
            throw new InvalidAmountException(amount, "deposit must be positive with at most 2 decimal places");
        }
        String key = IdempotencyKeys.deposit(reference);
        CreditResult result = walletGateway.credit(userId, Money.of(amount), key);
        if (result == CreditResult.FAILED) {
            throw new SettlementPendingException(userId, key, null);
        }
        log.info("Deposit applied: userId={} amount={} key={} result={}", userId, amount.toPlainString(), key, result);
        return result;
    }
}
