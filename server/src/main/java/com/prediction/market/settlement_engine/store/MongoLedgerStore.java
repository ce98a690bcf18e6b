package com.prediction.market.settlement_engine.store;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.bson.types.Decimal128;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.settlement_engine.engine.PoolState;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.MarketStatus;
import com.prediction.market.settlement_engine.entity.PendingDebit;
import com.prediction.market.settlement_engine.entity.PendingDebitStatus;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.repositories.BetRepository;
import com.prediction.market.settlement_engine.repositories.MarketRepository;
import com.prediction.market.settlement_engine.repositories.PendingDebitRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * MongoDB ledger store. Multi-document transactions need a replica set.
 *
 * Conditional updates that write decimals go through MongoTemplate with
 * explicit Decimal128 values; status-only transitions use the repositories.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private final MarketRepository marketRepository;
    private final BetRepository betRepository;
    private final PendingDebitRepository pendingDebitRepository;
    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public Optional<Market> findMarket(String marketId) {
        return marketRepository.findById(marketId);
    }

    @Override
    public Market insertMarket(Market market) {
        return marketRepository.insert(market);
    }

    @Override
    public boolean compareAndSetPools(String marketId, long expectedRevision, PoolState next, long updatedAt) {
        Query query = new Query(where("_id").is(marketId)
                .and("revision").is(expectedRevision)
                .and("status").is(MarketStatus.OPEN.name()));
        Update update = new Update()
                .set("yesPool", decimal(next.yesPool().toBigDecimal()))
                .set("noPool", decimal(next.noPool().toBigDecimal()))
                .set("totalVolume", decimal(next.totalVolume().toBigDecimal()))
                .set("revision", next.revision())
                .set("updatedAt", updatedAt);
        return mongoTemplate.updateFirst(query, update, Market.class).getModifiedCount() == 1;
    }

    @Override
    public boolean markResolved(String marketId, Side outcome, String note, long resolvedAt) {
        return marketRepository.atomicResolve(marketId, outcome, note, resolvedAt) == 1;
    }

    @Override
    public long markBetsResolved(String marketId) {
        return betRepository.markResolvedByMarketId(marketId);
    }

    @Override
    public boolean updateFeeRates(String marketId, BigDecimal platformFeeRate, BigDecimal creatorFeeRate,
            long updatedAt) {
        Query query = new Query(where("_id").is(marketId).and("status").is(MarketStatus.OPEN.name()));
        Update update = new Update()
                .set("platformFeeRate", platformFeeRate == null ? null : decimal(platformFeeRate))
                .set("creatorFeeRate", creatorFeeRate == null ? null : decimal(creatorFeeRate))
                .set("updatedAt", updatedAt)
                .inc("revision", 1);
        return mongoTemplate.updateFirst(query, update, Market.class).getModifiedCount() == 1;
    }

    @Override
    public Bet insertBet(Bet bet) {
        return betRepository.insert(bet);
    }

    @Override
    public Optional<Bet> findBet(String betId) {
        return betRepository.findById(betId);
    }

    @Override
    public Optional<Bet> findBetByNonce(String userId, String nonce) {
        return betRepository.findByUserIdAndNonce(userId, nonce);
    }

    @Override
    public List<Bet> findBetsByUser(String userId) {
        return betRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Override
    public List<Bet> findBetsByMarket(String marketId) {
        return betRepository.findByMarketIdOrderByCreatedAtDesc(marketId);
    }

    @Override
    public List<Bet> findUnclaimedBets(String userId) {
        return betRepository.findByUserIdAndResolvedTrueAndClaimedFalseOrderByCreatedAtDesc(userId);
    }

    @Override
    public boolean markClaimed(String betId, BigDecimal payout, TransferStatus transferStatus, String transferKey,
            long claimedAt) {
        Query query = new Query(where("_id").is(betId).and("claimed").is(false));
        Update update = new Update()
                .set("claimed", true)
                .set("claimedAt", claimedAt)
                .set("payout", decimal(payout))
                .set("transferStatus", transferStatus.name())
                .set("transferKey", transferKey)
                .set("transferUpdatedAt", claimedAt);
        return mongoTemplate.updateFirst(query, update, Bet.class).getModifiedCount() == 1;
    }

    @Override
    public boolean transitionTransfer(String betId, TransferStatus from, TransferStatus to, String error,
            long updatedAt) {
        return betRepository.atomicTransferTransition(betId, from, to, error, updatedAt) == 1;
    }

    @Override
    public boolean transitionFeeStatus(String betId, TransferStatus from, TransferStatus to, long updatedAt) {
        return betRepository.atomicFeeTransition(betId, from, to, updatedAt) == 1;
    }

    @Override
    public List<Bet> findStalledTransfers(Collection<TransferStatus> statuses, long updatedBefore, int limit) {
        return betRepository.findByTransferStatusInAndTransferUpdatedAtLessThan(
                statuses, updatedBefore, PageRequest.of(0, limit, Sort.by("transferUpdatedAt")));
    }

    @Override
    public List<Bet> findStalledFeeRoutings(long updatedBefore, int limit) {
        return betRepository.findByFeeStatusAndFeeUpdatedAtLessThan(
                TransferStatus.PENDING, updatedBefore, PageRequest.of(0, limit, Sort.by("feeUpdatedAt")));
    }

    @Override
    public PendingDebit savePendingDebit(PendingDebit pendingDebit) {
        return pendingDebitRepository.save(pendingDebit);
    }

    @Override
    public List<PendingDebit> findOpenPendingDebits(long createdBefore, int limit) {
        return pendingDebitRepository.findByStatusAndCreatedAtLessThan(
                PendingDebitStatus.OPEN, createdBefore, PageRequest.of(0, limit, Sort.by("createdAt")));
    }

    @Override
    public boolean closePendingDebit(String key, PendingDebitStatus status, long closedAt) {
        return pendingDebitRepository.atomicClose(key, status, closedAt) == 1;
    }

    private static Decimal128 decimal(BigDecimal value) {
        return new Decimal128(value);
    }
}
