package com.prediction.market.settlement_engine.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.TransferStatus;

/**
 * Repository for Bet with atomic claim and transfer transitions.
 *
 * Every transition is conditional on the expected current state so that
 * concurrent claimers, retries and the recovery job cannot double-apply.
 */
@Repository
public interface BetRepository extends MongoRepository<Bet, String> {

    /**
     * Idempotency lookup for client nonces.
     */
    Optional<Bet> findByUserIdAndNonce(String userId, String nonce);

    List<Bet> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Bet> findByMarketIdOrderByCreatedAtDesc(String marketId);

    List<Bet> findByUserIdAndResolvedTrueAndClaimedFalseOrderByCreatedAtDesc(String userId);

    List<Bet> findByTransferStatusInAndTransferUpdatedAtLessThan(
            Collection<TransferStatus> statuses, long updatedBefore, Pageable pageable);

    List<Bet> findByFeeStatusAndFeeUpdatedAtLessThan(TransferStatus feeStatus, long updatedBefore, Pageable pageable);

    /**
     * Flag every bet of a market as resolved. Runs in the resolution transaction.
     *
     * @return number of bets modified
     */
    @Query("{ 'marketId': ?0, 'resolved': false }")
    @Update("{ $set: { 'resolved': true } }")
    long markResolvedByMarketId(String marketId);

    /**
     * Atomically move the payout transfer from the expected status to a new one.
     *
     * @return 1 if the transition applied, 0 on status mismatch
     */
    @Query("{ 'id': ?0, 'transferStatus': ?1 }")
    @Update("{ $set: { 'transferStatus': ?2, 'transferError': ?3, 'transferUpdatedAt': ?4 } }")
    long atomicTransferTransition(String betId, TransferStatus expected, TransferStatus next, String error,
            long timestamp);

    @Query("{ 'id': ?0, 'feeStatus': ?1 }")
    @Update("{ $set: { 'feeStatus': ?2, 'feeUpdatedAt': ?3 } }")
    long atomicFeeTransition(String betId, TransferStatus expected, TransferStatus next, long timestamp);
}
