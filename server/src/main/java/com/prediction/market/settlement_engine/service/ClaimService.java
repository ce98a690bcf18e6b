package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.engine.PricingEngine;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.exception.AlreadyClaimedException;
import com.prediction.market.settlement_engine.exception.BetNotFoundException;
import com.prediction.market.settlement_engine.exception.MarketNotFoundException;
import com.prediction.market.settlement_engine.exception.MarketNotResolvedException;
import com.prediction.market.settlement_engine.exception.NotBetOwnerException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.exception.WalletUnavailableException;
import com.prediction.market.settlement_engine.store.LedgerStore;
import com.prediction.market.settlement_engine.wallet.CreditResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claim processing - converts a resolved bet into at most one wallet credit.
 *
 * The claimed flag is flipped by a compare-and-set before any money moves, so
 * exactly one of any number of concurrent claimers proceeds. The transfer is
 * recorded as PENDING first and every credit for the bet uses the key
 * bet:{id}:payout, so retries and the recovery job can never pay twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimService {

    private final LedgerStore ledgerStore;
    private final PricingEngine pricingEngine;
    private final WalletGateway walletGateway;
    private final Clock clock;

    public PayoutResult claim(String betId, String requesterId) {
        Bet bet = requireOwnedBet(betId, requesterId);
        Market market = requireResolvedMarket(bet.getMarketId());
        if (bet.isClaimed()) {
            throw new AlreadyClaimedException(betId);
        }

        boolean won = bet.isWinningFor(market.getOutcome());
        Money payout = won ? computePayout(bet) : Money.ZERO;
        TransferStatus initial = payout.isPositive() ? TransferStatus.PENDING : TransferStatus.NOT_REQUIRED;
        String transferKey = initial == TransferStatus.PENDING ? IdempotencyKeys.payout(betId) : null;

        long now = clock.millis();
        if (!ledgerStore.markClaimed(betId, payout.toBigDecimal(), initial, transferKey, now)) {
            throw new AlreadyClaimedException(betId);
        }

        if (initial == TransferStatus.NOT_REQUIRED) {
            log.debug("Claim settled without transfer betId={} won={}", betId, won);
            return result(bet, market, won, payout, initial, null);
        }

        TransferStatus status = deliverPayout(betId, bet.getUserId(), payout, transferKey, TransferStatus.PENDING);
        return result(bet, market, true, payout, status, transferKey);
    }

    /**
     * Re-drives a claimed bet's transfer with its original key. Terminal
     * transfers return the recorded result.
     */
    public PayoutResult retryTransfer(String betId, String requesterId) {
        Bet bet = requireOwnedBet(betId, requesterId);
        if (!bet.isClaimed()) {
            return claim(betId, requesterId);
        }
        return redrive(bet);
    }

    /**
     * Shared by retryTransfer and TransferRecoveryJob; no ownership check.
     */
    public PayoutResult redrive(Bet bet) {
        Market market = requireResolvedMarket(bet.getMarketId());
        Money payout = Money.ofNullable(bet.getPayout());
        boolean won = bet.isWinningFor(market.getOutcome());
        TransferStatus status = bet.getTransferStatus();

        if (status == null || !status.isRetryable()) {
            return result(bet, market, won, payout, status, bet.getTransferKey());
        }

        TransferStatus from = status;
        if (status == TransferStatus.FAILED) {
            if (!ledgerStore.transitionTransfer(bet.getId(), TransferStatus.FAILED, TransferStatus.PENDING, null,
                    clock.millis())) {
                // someone else picked it up
                Bet current = ledgerStore.findBet(bet.getId()).orElse(bet);
                return result(current, market, won, payout, current.getTransferStatus(), current.getTransferKey());
            }
            from = TransferStatus.PENDING;
        }

        TransferStatus delivered = deliverPayout(bet.getId(), bet.getUserId(), payout, bet.getTransferKey(), from);
        return result(bet, market, won, payout, delivered, bet.getTransferKey());
    }

    public UnclaimedWinnings unclaimedWinnings(String userId) {
        Map<String, Optional<Market>> markets = new HashMap<>();
        List<PayoutResult> winners = new ArrayList<>();
        Money total = Money.ZERO;

        for (Bet bet : ledgerStore.findUnclaimedBets(userId)) {
            Optional<Market> market = markets.computeIfAbsent(bet.getMarketId(), ledgerStore::findMarket);
            if (market.isEmpty() || !market.get().isResolved() || !bet.isWinningFor(market.get().getOutcome())) {
                continue;
            }
            Money payout = computePayout(bet);
            total = total.add(payout);
            winners.add(result(bet, market.get(), true, payout, null, null));
        }
        return new UnclaimedWinnings(userId, total.toBigDecimal(), winners);
    }

    public Money computePayout(Bet bet) {
        return pricingEngine.payout(bet.netStakeMoney(), bet.getPrice());
    }

    /**
     * One credit attempt from the given non-terminal state.
     *
     * @throws SettlementPendingException if the wallet rejected or could not be reached
     */
    private TransferStatus deliverPayout(String betId, String userId, Money payout, String key, TransferStatus from) {
        CreditResult result;
        try {
            result = walletGateway.credit(userId, payout, key);
        } catch (WalletUnavailableException e) {
            advance(betId, from, TransferStatus.FAILED, e.getMessage());
            throw new SettlementPendingException(betId, key, e);
        }

        switch (result) {
            case OK:
                advance(betId, from, TransferStatus.CONFIRMED, null);
                log.info("Payout confirmed: betId={} userId={} payout={} key={}", betId, userId, payout, key);
                return TransferStatus.CONFIRMED;
            case PENDING:
                if (from != TransferStatus.SENT) {
                    advance(betId, from, TransferStatus.SENT, null);
                }
                log.info("Payout sent, awaiting confirmation: betId={} key={}", betId, key);
                return TransferStatus.SENT;
            default:
                advance(betId, from, TransferStatus.FAILED, "wallet rejected credit");
                log.warn("Payout failed betId={} key={}", betId, key);
                throw new SettlementPendingException(betId, key, null);
        }
    }

    private void advance(String betId, TransferStatus from, TransferStatus to, String error) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException(String.format("Invalid transfer transition %s -> %s", from, to));
        }
        if (!ledgerStore.transitionTransfer(betId, from, to, error, clock.millis())) {
            log.warn("Transfer state moved concurrently betId={} expected={} target={}", betId, from, to);
        }
    }

    private Bet requireOwnedBet(String betId, String requesterId) {
        Bet bet = ledgerStore.findBet(betId).orElseThrow(() -> new BetNotFoundException(betId));
        if (!bet.getUserId().equals(requesterId)) {
            throw new NotBetOwnerException(betId, requesterId);
        }
        return bet;
    }

    // Read from the ledger, not the cache: another process may have resolved it.
    private Market requireResolvedMarket(String marketId) {
        Market market = ledgerStore.findMarket(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
        if (!market.isResolved()) {
            throw new MarketNotResolvedException(marketId);
        }
        return market;
    }

    private static PayoutResult result(Bet bet, Market market, boolean won, Money payout, TransferStatus status,
            String transferKey) {
        BigDecimal amount = payout == null ? null : payout.toBigDecimal();
        return new PayoutResult(bet.getId(), bet.getMarketId(), bet.getSide(), market.getOutcome(), won, amount,
                status, transferKey);
    }
}
