package com.prediction.market.settlement_engine.service;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.PendingDebit;
import com.prediction.market.settlement_engine.entity.PendingDebitStatus;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.exception.WalletUnavailableException;
import com.prediction.market.settlement_engine.store.LedgerStore;
import com.prediction.market.settlement_engine.wallet.CreditResult;
import com.prediction.market.settlement_engine.wallet.DebitResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Undoes debits whose bet never committed.
 *
 * A debit is never kept without its bet: it is either refunded right away or
 * recorded as a pending debit that the recovery job reverses later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DebitCompensationService {

    private final WalletGateway walletGateway;
    private final LedgerStore ledgerStore;
    private final Clock clock;

    /**
     * Refunds a debit that is known to have been applied.
     *
     * @throws SettlementPendingException if the refund could not be confirmed
     */
    public void refund(String betId, String userId, String marketId, Money amount, String reason) {
        String refundKey = IdempotencyKeys.refund(betId);
        try {
            CreditResult result = walletGateway.credit(userId, amount, refundKey);
            if (result != CreditResult.FAILED) {
                log.warn("Compensated debit betId={} userId={} amount={} result={} reason={}",
                        betId, userId, amount, result, reason);
                return;
            }
            throw recordPendingDebit(betId, userId, marketId, amount, "refund rejected: " + reason, null);
        } catch (WalletUnavailableException e) {
            throw recordPendingDebit(betId, userId, marketId, amount, "refund unavailable: " + reason, e);
        }
    }

    /**
     * Records a debit whose outcome is unknown and returns the exception to raise.
     */
    public SettlementPendingException recordPendingDebit(String betId, String userId, String marketId, Money amount,
            String reason, Throwable cause) {
        String debitKey = IdempotencyKeys.debit(betId);
        ledgerStore.savePendingDebit(PendingDebit.builder()
                .key(debitKey)
                .betId(betId)
                .userId(userId)
                .marketId(marketId)
                .amount(amount.toBigDecimal())
                .reason(reason)
                .createdAt(clock.millis())
                .build());
        log.error("Pending debit recorded key={} userId={} amount={} reason={}", debitKey, userId, amount, reason);
        return new SettlementPendingException(betId, debitKey, cause);
    }

    /**
     * Replays the debit with its original key, then refunds whatever it confirms.
     * A replay answering OK means the debit is (now) applied, so both cases
     * where funds moved end refunded.
     *
     * @return the status the pending debit was closed with, or OPEN if it stays open
     */
    public PendingDebitStatus reverse(PendingDebit pending) {
        Money amount = Money.of(pending.getAmount());
        DebitResult replay = walletGateway.debit(pending.getUserId(), amount, pending.getKey());
        PendingDebitStatus outcome;
        if (replay == DebitResult.INSUFFICIENT) {
            outcome = PendingDebitStatus.CLEARED;
        } else {
            CreditResult refund = walletGateway.credit(pending.getUserId(), amount,
                    IdempotencyKeys.refund(pending.getBetId()));
            if (refund == CreditResult.FAILED) {
                log.warn("Refund still failing key={} userId={}", pending.getKey(), pending.getUserId());
                return PendingDebitStatus.OPEN;
            }
            outcome = PendingDebitStatus.REVERSED;
        }
        if (ledgerStore.closePendingDebit(pending.getKey(), outcome, clock.millis())) {
            log.info("Pending debit closed key={} status={}", pending.getKey(), outcome);
        }
        return outcome;
    }
}
