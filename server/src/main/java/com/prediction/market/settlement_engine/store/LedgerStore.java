package com.prediction.market.settlement_engine.store;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.prediction.market.settlement_engine.engine.PoolState;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.PendingDebit;
import com.prediction.market.settlement_engine.entity.PendingDebitStatus;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;

/**
 * Durable storage of markets, bets and pending debits.
 *
 * Every mutating method that returns boolean is a conditional update: it
 * returns false when the guard did not match and nothing was written.
 */
public interface LedgerStore {

    /**
     * Runs the work in one transaction. Any exception rolls back every write
     * made through this store inside the callback and is rethrown.
     */
    <T> T inTransaction(Supplier<T> work);

    // --- markets ---

    Optional<Market> findMarket(String marketId);

    Market insertMarket(Market market);

    /**
     * {id, revision == expectedRevision, status == OPEN} -> pools, volume, revision.
     */
    boolean compareAndSetPools(String marketId, long expectedRevision, PoolState next, long updatedAt);

    /**
     * {id, status == OPEN} -> RESOLVED with outcome.
     */
    boolean markResolved(String marketId, Side outcome, String note, long resolvedAt);

    /**
     * Sets resolved=true on every bet of the market. Returns the number of bets touched.
     */
    long markBetsResolved(String marketId);

    /**
     * {id, status == OPEN} -> fee rates, revision + 1.
     */
    boolean updateFeeRates(String marketId, BigDecimal platformFeeRate, BigDecimal creatorFeeRate, long updatedAt);

    // --- bets ---

    Bet insertBet(Bet bet);

    Optional<Bet> findBet(String betId);

    Optional<Bet> findBetByNonce(String userId, String nonce);

    List<Bet> findBetsByUser(String userId);

    List<Bet> findBetsByMarket(String marketId);

    /**
     * Resolved, unclaimed bets of a user; winners are filtered by the caller.
     */
    List<Bet> findUnclaimedBets(String userId);

    /**
     * {id, claimed == false} -> claimed, payout, transfer state. Exactly one caller wins.
     */
    boolean markClaimed(String betId, BigDecimal payout, TransferStatus transferStatus, String transferKey,
            long claimedAt);

    /**
     * {id, transferStatus == from} -> to.
     */
    boolean transitionTransfer(String betId, TransferStatus from, TransferStatus to, String error, long updatedAt);

    /**
     * {id, feeStatus == from} -> to.
     */
    boolean transitionFeeStatus(String betId, TransferStatus from, TransferStatus to, long updatedAt);

    List<Bet> findStalledTransfers(Collection<TransferStatus> statuses, long updatedBefore, int limit);

    List<Bet> findStalledFeeRoutings(long updatedBefore, int limit);

    // --- pending debits ---

    PendingDebit savePendingDebit(PendingDebit pendingDebit);

    List<PendingDebit> findOpenPendingDebits(long createdBefore, int limit);

    /**
     * {key, status == OPEN} -> status.
     */
    boolean closePendingDebit(String key, PendingDebitStatus status, long closedAt);
}
