package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.engine.FeeBreakdown;
import com.prediction.market.settlement_engine.engine.FeeCalculator;
import com.prediction.market.settlement_engine.engine.PoolManager;
import com.prediction.market.settlement_engine.engine.PoolState;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.exception.AmountTooSmallException;
import com.prediction.market.settlement_engine.exception.InsufficientFundsException;
import com.prediction.market.settlement_engine.exception.MarketClosedException;
import com.prediction.market.settlement_engine.exception.WalletUnavailableException;
import com.prediction.market.settlement_engine.execution.MarketExecutionRegistry;
import com.prediction.market.settlement_engine.store.LedgerStore;
import com.prediction.market.settlement_engine.wallet.DebitResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bet execution - validates and executes a single bet.
 *
 * Bet Flow:
 * 1. Validate amount and side (caller thread)
 * 2. On the market's executor:
 *    a. Nonce replay returns the existing bet
 *    b. Market open and before end date, balance covers the amount
 *    c. Lock the side's current price, split fees
 *    d. Debit the gross amount (key bet:{id}:debit)
 *    e. One transaction: pool compare-and-set + bet insert
 *    f. Publish the committed pools to the cache
 * 3. Route fees (after commit, never fails the bet)
 *
 * CRITICAL PROPERTIES:
 * - Pools never move without a debit and a debit is never kept without a bet
 * - Readers only see committed pool snapshots
 * - Idempotent per (userId, nonce)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BetExecutionService {

    private final MarketExecutionRegistry executionRegistry;
    private final MarketStore marketStore;
    private final PoolManager poolManager;
    private final FeeCalculator feeCalculator;
    private final LedgerStore ledgerStore;
    private final BetValidator betValidator;
    private final WalletGateway walletGateway;
    private final DebitCompensationService compensationService;
    private final FeeDistributionService feeDistributionService;
    private final Clock clock;

    /**
     * Place a bet on one side of a market.
     *
     * @param marketId the market
     * @param userId the bettor
     * @param side YES or NO
     * @param grossAmount what the user authorizes; fees come out of it
     * @param nonce optional client idempotency token
     * @return the executed (or replayed) bet
     */
    public Bet placeBet(String marketId, String userId, Side side, BigDecimal grossAmount, String nonce) {
        Money gross = betValidator.validateRequest(userId, side, grossAmount);
        if (marketId == null || marketId.isBlank() || marketStore.getMarket(marketId) == null) {
            // checked before an executor is registered for the id
            throw new MarketClosedException(String.valueOf(marketId), "market does not exist");
        }

        Bet bet = executionRegistry.execute(marketId, () -> execute(marketId, userId, side, gross, nonce));

        if (bet.getFeeStatus() == TransferStatus.PENDING) {
            feeDistributionService.distribute(bet, marketStore.getMarket(marketId));
        }
        return bet;
    }

    /**
     * Runs on the market's executor thread.
     */
    private Bet execute(String marketId, String userId, Side side, Money gross, String nonce) {
        if (nonce != null) {
            Optional<Bet> existing = ledgerStore.findBetByNonce(userId, nonce);
            if (existing.isPresent()) {
                log.info("Duplicate bet request, returning existing bet: betId={} nonce={}",
                        existing.get().getId(), nonce);
                return existing.get();
            }
        }

        Market market = marketStore.getMarket(marketId);
        if (market == null) {
            throw new MarketClosedException(marketId, "market does not exist");
        }
        long now = clock.millis();
        betValidator.validateMarketOpen(market, now);
        betValidator.validateFunds(userId, gross);

        BigDecimal price = poolManager.currentPrice(marketId, side);
        FeeBreakdown fees = feeCalculator.calculate(market, gross);
        if (!fees.netStake().isPositive()) {
            throw new AmountTooSmallException(gross, fees.netStake());
        }

        String betId = UUID.randomUUID().toString();
        debit(betId, userId, marketId, gross);

        Bet bet = Bet.builder()
                .id(betId)
                .marketId(marketId)
                .userId(userId)
                .side(side)
                .grossAmount(gross.toBigDecimal())
                .platformFee(fees.platformFee().toBigDecimal())
                .creatorFee(fees.creatorFee().toBigDecimal())
                .netStake(fees.netStake().toBigDecimal())
                .price(price)
                .nonce(nonce)
                .createdAt(now)
                .feeStatus(TransferStatus.PENDING)
                .feeUpdatedAt(now)
                .build();

        PoolState committed;
        try {
            committed = ledgerStore.inTransaction(() -> {
                PoolState next = poolManager.applyStake(marketId, side, fees.netStake(), gross);
                ledgerStore.insertBet(bet);
                return next;
            });
        } catch (RuntimeException e) {
            poolManager.invalidate(marketId);
            if (e instanceof DuplicateKeyException && nonce != null) {
                // same nonce committed concurrently from another market's executor
                compensationService.refund(betId, userId, marketId, gross, "duplicate nonce");
                return ledgerStore.findBetByNonce(userId, nonce).orElseThrow(() -> e);
            }
            log.warn("Bet commit failed, compensating betId={} marketId={} error={}", betId, marketId, e.toString());
            compensationService.refund(betId, userId, marketId, gross, e.getClass().getSimpleName());
            throw e;
        }

        poolManager.publish(marketId, committed);
        log.info("Bet executed: betId={} userId={} marketId={} side={} gross={} net={} price={} yesPool={} noPool={}",
                betId, userId, marketId, side, gross, fees.netStake(), price.toPlainString(),
                committed.yesPool(), committed.noPool());
        return bet;
    }

    private void debit(String betId, String userId, String marketId, Money gross) {
        String key = IdempotencyKeys.debit(betId);
        DebitResult result;
        try {
            result = walletGateway.debit(userId, gross, key);
        } catch (WalletUnavailableException e) {
            throw compensationService.recordPendingDebit(betId, userId, marketId, gross, "debit outcome unknown", e);
        }
        if (result == DebitResult.INSUFFICIENT) {
            log.warn("Bet rejected userId={} reason=debit-insufficient amount={}", userId, gross);
            throw new InsufficientFundsException(userId, gross, null);
        }
    }
}
