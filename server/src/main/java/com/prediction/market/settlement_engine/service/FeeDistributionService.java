package com.prediction.market.settlement_engine.service;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.config.SettlementProperties;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.exception.SettlementException;
import com.prediction.market.settlement_engine.store.LedgerStore;
import com.prediction.market.settlement_engine.wallet.CreditResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes a committed bet's fees: the platform fee to the platform account and
 * the creator fee to the market's creator.
 *
 * Runs after commit and never fails the bet. Anything not confirmed stays
 * PENDING for TransferRecoveryJob; the per-bet keys keep re-routing safe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeDistributionService {

    private final WalletGateway walletGateway;
    private final LedgerStore ledgerStore;
    private final SettlementProperties properties;
    private final Clock clock;

    public TransferStatus distribute(Bet bet, Market market) {
        if (bet.getFeeStatus() != TransferStatus.PENDING) {
            return bet.getFeeStatus();
        }
        Money platformFee = Money.ofNullable(bet.getPlatformFee());
        Money creatorFee = Money.ofNullable(bet.getCreatorFee());
        if (platformFee.isZero() && creatorFee.isZero()) {
            return advance(bet, TransferStatus.NOT_REQUIRED);
        }

        // creator-less markets pay the creator share to the platform
        String creatorAccount = market != null && market.getCreatorId() != null
                ? market.getCreatorId()
                : properties.platformAccountId();

        boolean confirmed = route(bet, properties.platformAccountId(), platformFee,
                IdempotencyKeys.platformFee(bet.getId()))
                & route(bet, creatorAccount, creatorFee, IdempotencyKeys.creatorFee(bet.getId()));

        return confirmed ? advance(bet, TransferStatus.CONFIRMED) : TransferStatus.PENDING;
    }

    private boolean route(Bet bet, String accountId, Money fee, String key) {
        if (fee.isZero()) {
            return true;
        }
        try {
            CreditResult result = walletGateway.credit(accountId, fee, key);
            if (result != CreditResult.OK) {
                log.warn("Fee routing not confirmed betId={} key={} result={}", bet.getId(), key, result);
            }
            return result == CreditResult.OK;
        } catch (SettlementException e) {
            log.warn("Fee routing deferred betId={} key={} error={}", bet.getId(), key, e.getMessage());
            return false;
        }
    }

    private TransferStatus advance(Bet bet, TransferStatus next) {
        if (ledgerStore.transitionFeeStatus(bet.getId(), TransferStatus.PENDING, next, clock.millis())) {
            log.debug("Fees routed betId={} feeStatus={}", bet.getId(), next);
        }
        bet.setFeeStatus(next);
        return next;
    }
}
