package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.config.SettlementProperties;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.InsufficientFundsException;
import com.prediction.market.settlement_engine.exception.InvalidAmountException;
import com.prediction.market.settlement_engine.exception.InvalidBetException;
import com.prediction.market.settlement_engine.exception.MarketClosedException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bet preconditions, checked in a fixed order; the first failure is thrown.
 *
 * Validation has no side effects. Request-shape checks run on the caller's
 * thread, market and balance checks on the market's executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BetValidator {

    private final SettlementProperties properties;
    private final WalletGateway walletGateway;

    /**
     * Amount and side of the request.
     *
     * @return the gross amount in settlement units
     */
    public Money validateRequest(String userId, Side side, BigDecimal grossAmount) {
        Money gross = validateAmount(grossAmount);
        if (side == null) {
            throw new InvalidBetException("side is required (YES or NO)");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidBetException("userId is required");
        }
        return gross;
    }

    public Money validateAmount(BigDecimal grossAmount) {
        if (grossAmount == null) {
            throw new InvalidAmountException(null, "amount is required");
        }
        if (grossAmount.signum() <= 0) {
            throw new InvalidAmountException(grossAmount, "must be positive");
        }
        if (!Money.isExact(grossAmount)) {
            throw new InvalidAmountException(grossAmount, "at most 2 decimal places");
        }
        if (grossAmount.compareTo(properties.maxBetAmount()) > 0) {
            throw new InvalidAmountException(grossAmount, "cannot exceed " + properties.maxBetAmount().toPlainString());
        }
        return Money.of(grossAmount);
    }

    public void validateMarketOpen(Market market, long now) {
        if (!market.isOpen()) {
            log.warn("Bet rejected marketId={} reason=status status={}", market.getId(), market.getStatus());
            throw new MarketClosedException(market.getId(), "status is " + market.getStatus());
        }
        if (now >= market.getEndDate()) {
            log.warn("Bet rejected marketId={} reason=expired endDate={}", market.getId(), market.getEndDate());
            throw new MarketClosedException(market.getId(), "betting period has ended");
        }
    }

    public void validateFunds(String userId, Money grossAmount) {
        Money available = walletGateway.availableBalance(userId);
        if (available.isLessThan(grossAmount)) {
            log.warn("Bet rejected userId={} reason=funds available={} required={}", userId, available, grossAmount);
            throw new InsufficientFundsException(userId, grossAmount, available);
        }
    }
}
