package com.prediction.market.settlement_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.Transaction;

import java.util.List;

@Repository
public interface TransactionRepository extends MongoRepository<Transaction, String> {
    /**
     * Check if a wallet call with the given idempotency key was already applied.
     *
     * @param nonce the idempotency key
     * @return true if an entry exists
     */
    boolean existsByNonce(String nonce);

    /**
     * Find all entries for a user to recompute their balance.
     * Used by reconciliation only; O(n) in the user's history.
     *
     * @param userId the account id
     * @return every ledger entry of the account
     */
    @Query("{ 'userId': ?0 }")
    List<Transaction> findAllByUserIdForBalanceCompute(String userId);
}
