package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.config.SettlementProperties;
import com.prediction.market.settlement_engine.engine.FeeBreakdown;
import com.prediction.market.settlement_engine.engine.FeeCalculator;
import com.prediction.market.settlement_engine.engine.PoolState;
import com.prediction.market.settlement_engine.engine.PricingEngine;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.MarketStatus;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.AlreadyResolvedException;
import com.prediction.market.settlement_engine.exception.InvalidBetException;
import com.prediction.market.settlement_engine.exception.InvalidMarketException;
import com.prediction.market.settlement_engine.exception.MarketNotFoundException;
import com.prediction.market.settlement_engine.execution.MarketExecutionRegistry;
import com.prediction.market.settlement_engine.store.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Market administration and read models: creation, fee overrides, quotes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketService {

    private final MarketStore marketStore;
    private final LedgerStore ledgerStore;
    private final MarketExecutionRegistry executionRegistry;
    private final PricingEngine pricingEngine;
    private final FeeCalculator feeCalculator;
    private final BetValidator betValidator;
    private final SettlementProperties properties;
    private final Clock clock;

    public Market createMarket(String title, String categoryId, String creatorId, long endDate,
            BigDecimal seedLiquidity) {
        if (title == null || title.isBlank()) {
            throw new InvalidMarketException("title is required");
        }
        if (creatorId == null || creatorId.isBlank()) {
            throw new InvalidMarketException("creatorId is required");
        }
        long now = clock.millis();
        if (endDate <= now) {
            throw new InvalidMarketException("endDate must be in the future");
        }
        BigDecimal seed = seedLiquidity != null ? seedLiquidity : properties.seedLiquidity();
        if (seed.signum() <= 0 || !Money.isExact(seed)) {
            throw new InvalidMarketException("seedLiquidity must be positive with at most 2 decimal places");
        }

        Money seedMoney = Money.of(seed);
        Market market = Market.builder()
                .id(UUID.randomUUID().toString())
                .title(title.trim())
                .categoryId(categoryId)
                .creatorId(creatorId)
                .seedLiquidity(seedMoney.toBigDecimal())
                .yesPool(seedMoney.toBigDecimal())
                .noPool(seedMoney.toBigDecimal())
                .totalVolume(Money.ZERO.toBigDecimal())
                .status(MarketStatus.OPEN)
                .endDate(endDate)
                .revision(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Market saved = ledgerStore.insertMarket(market);
        marketStore.put(saved);
        log.info("Market created: marketId={} creatorId={} seed={} endDate={}",
                saved.getId(), creatorId, seedMoney, endDate);
        return saved;
    }

    public Market getMarket(String marketId) {
        Market market = marketStore.getMarket(marketId);
        if (market == null) {
            throw new MarketNotFoundException(marketId);
        }
        return market;
    }

    public MarketView view(String marketId) {
        return toView(getMarket(marketId));
    }

    public MarketView toView(Market market) {
        PoolState pools = PoolState.of(market);
        BigDecimal yesPrice = null;
        BigDecimal noPrice = null;
        if (pools.yesPool().isPositive() && pools.noPool().isPositive()) {
            yesPrice = pricingEngine.price(Side.YES, pools);
            noPrice = pricingEngine.price(Side.NO, pools);
        }
        return new MarketView(market.getId(), market.getTitle(), market.getCategoryId(), market.getCreatorId(),
                pools.yesPool().toBigDecimal(), pools.noPool().toBigDecimal(), yesPrice, noPrice,
                pools.totalVolume().toBigDecimal(), market.getStatus(), market.getOutcome(), market.getEndDate(),
                market.getResolvedAt(), market.getResolutionNote(), market.getPlatformFeeRate(),
                market.getCreatorFeeRate(), market.getRevision());
    }

    public BetQuote quote(String marketId, Side side, BigDecimal grossAmount) {
        Money gross = betValidator.validateAmount(grossAmount);
        if (side == null) {
            throw new InvalidBetException("side is required (YES or NO)");
        }
        Market market = getMarket(marketId);
        BigDecimal price = pricingEngine.price(side, PoolState.of(market));
        FeeBreakdown fees = feeCalculator.calculate(market, gross);
        Money potentialPayout = fees.netStake().isPositive()
                ? pricingEngine.payout(fees.netStake(), price)
                : Money.ZERO;
        return new BetQuote(marketId, side, gross.toBigDecimal(), price, pricingEngine.odds(price),
                fees.platformFee().toBigDecimal(), fees.creatorFee().toBigDecimal(),
                fees.netStake().toBigDecimal(), potentialPayout.toBigDecimal());
    }

    /**
     * Sets per-market fee rates on an open market. A null rate keeps the current value.
     * Runs on the market's executor so no bet sees a half-applied change.
     */
    public Market updateFeeRates(String marketId, BigDecimal platformFeeRate, BigDecimal creatorFeeRate) {
        Market current = getMarket(marketId);
        if (current.isResolved()) {
            throw new AlreadyResolvedException(marketId, current.getOutcome());
        }
        return executionRegistry.execute(marketId, () -> {
            Market market = getMarket(marketId);
            if (market.isResolved()) {
                throw new AlreadyResolvedException(marketId, market.getOutcome());
            }
            BigDecimal platform = platformFeeRate != null ? platformFeeRate : market.getPlatformFeeRate();
            BigDecimal creator = creatorFeeRate != null ? creatorFeeRate : market.getCreatorFeeRate();
            try {
                FeeCalculator.validateRates(
                        platform != null ? platform : feeCalculator.getDefaultPlatformFeeRate(),
                        creator != null ? creator : feeCalculator.getDefaultCreatorFeeRate());
            } catch (IllegalArgumentException e) {
                throw new InvalidMarketException(e.getMessage());
            }

            long now = clock.millis();
            if (!ledgerStore.updateFeeRates(marketId, platform, creator, now)) {
                marketStore.evict(marketId);
                throw new AlreadyResolvedException(marketId, null);
            }
            Market updated = market.toBuilder()
                    .platformFeeRate(platform)
                    .creatorFeeRate(creator)
                    .revision(market.getRevision() + 1)
                    .updatedAt(now)
                    .build();
            marketStore.put(updated);
            log.info("Fee rates updated: marketId={} platformFeeRate={} creatorFeeRate={}",
                    marketId, platform, creator);
            return updated;
        });
    }

    public List<Bet> betsForMarket(String marketId) {
        getMarket(marketId);
        return ledgerStore.findBetsByMarket(marketId);
    }

    public List<Bet> betsForUser(String userId) {
        return ledgerStore.findBetsByUser(userId);
    }
}
