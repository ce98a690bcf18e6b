package com.prediction.market.settlement_engine.wallet;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import org.bson.types.Decimal128;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.settlement_engine.entity.Account;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Transaction;
import com.prediction.market.settlement_engine.repositories.AccountRepository;
import com.prediction.market.settlement_engine.repositories.TransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bundled wallet keeping platform balances in MongoDB.
 * The ledger (transactions collection) is the SOURCE OF TRUTH.
 * Account.balance is the spendable value and moves in the same transaction
 * as the ledger entry that explains it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerWalletService implements WalletService {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public Money availableBalance(String userId) {
        return accountRepository.findById(userId)
                .map(Account::balanceMoney)
                .orElse(Money.ZERO);
    }

    /**
     * Conditional decrement: only applies if the balance covers the amount.
     * A key seen before is answered OK without touching the balance.
     */
    @Override
    public DebitResult debit(String userId, Money amount, String idempotencyKey) {
        requirePositive(amount);
        if (transactionRepository.existsByNonce(idempotencyKey)) {
            log.debug("Debit replay key={} userId={}", idempotencyKey, userId);
            return DebitResult.OK;
        }

        try {
            return transactionTemplate.execute(status -> {
                long now = clock.millis();
                Account updated = mongoTemplate.findAndModify(
                        new Query(where("_id").is(userId).and("balance").gte(decimal(amount.toBigDecimal()))),
                        new Update()
                                .inc("balance", decimal(amount.negate().toBigDecimal()))
                                .set("updatedAt", now),
                        FindAndModifyOptions.options().returnNew(true),
                        Account.class);
                if (updated == null) {
                    status.setRollbackOnly();
                    return DebitResult.INSUFFICIENT;
                }
                transactionRepository.insert(entry(userId, "DEBIT", amount.negate(), idempotencyKey,
                        updated.getBalance(), now));
                return DebitResult.OK;
            });
        } catch (DuplicateKeyException e) {
            // concurrent call with the same key won
            log.debug("Debit raced on key={}, treating as applied", idempotencyKey);
            return DebitResult.OK;
        }
    }

    @Override
    public CreditResult credit(String userId, Money amount, String idempotencyKey) {
        requirePositive(amount);
        if (transactionRepository.existsByNonce(idempotencyKey)) {
            log.debug("Credit replay key={} userId={}", idempotencyKey, userId);
            return CreditResult.OK;
        }

        try {
            return transactionTemplate.execute(status -> {
                long now = clock.millis();
                Account updated = mongoTemplate.findAndModify(
                        new Query(where("_id").is(userId)),
                        new Update()
                                .inc("balance", decimal(amount.toBigDecimal()))
                                .set("updatedAt", now),
                        FindAndModifyOptions.options().returnNew(true).upsert(true),
                        Account.class);
                transactionRepository.insert(entry(userId, "CREDIT", amount, idempotencyKey,
                        updated.getBalance(), now));
                return CreditResult.OK;
            });
        } catch (DuplicateKeyException e) {
            log.debug("Credit raced on key={}, treating as applied", idempotencyKey);
            return CreditResult.OK;
        }
    }

    /**
     * Balance by summing every ledger entry of the account.
     * Used for reconciliation and auditing only; O(n) in the account history.
     */
    public Money computeBalanceFromLedgerFullScan(String userId) {
        List<Transaction> entries = transactionRepository.findAllByUserIdForBalanceCompute(userId);
        Money balance = Money.ZERO;
        for (Transaction entry : entries) {
            balance = balance.add(Money.of(entry.getAmount())); // signed
        }
        return balance;
    }

    /**
     * Periodic reconciliation job: every account balance must equal its ledger sum.
     * Drift is reported, not corrected, because either side could be the wrong one.
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public void reconcileAllBalances() {
        log.info("Starting balance reconciliation from ledger...");

        try {
            List<Account> accounts = accountRepository.findAll();
            int checked = 0;
            int drifted = 0;

            for (Account account : accounts) {
                Money cached = account.balanceMoney();
                Money ledger = computeBalanceFromLedgerFullScan(account.getUserId());
                if (!cached.equals(ledger)) {
                    log.error("Balance drift detected userId={} balance={} ledger={}",
                            account.getUserId(), cached, ledger);
                    drifted++;
                }
                checked++;
            }

            log.info("Balance reconciliation complete: {} accounts checked, {} drifted", checked, drifted);
        } catch (RuntimeException e) {
            log.error("Balance reconciliation failed: {}", e.getMessage(), e);
        }
    }

    private static Transaction entry(String userId, String type, Money signedAmount, String key,
            BigDecimal balanceAfter, long timestamp) {
        return Transaction.builder()
                .userId(userId)
                .transactionType(type)
                .amount(signedAmount.toBigDecimal())
                .nonce(key)
                .balanceAfter(balanceAfter)
                .timestamp(timestamp)
                .build();
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new IllegalArgumentException("Wallet amount must be positive: " + amount);
        }
    }

    private static Decimal128 decimal(BigDecimal value) {
        return new Decimal128(value);
    }
}
