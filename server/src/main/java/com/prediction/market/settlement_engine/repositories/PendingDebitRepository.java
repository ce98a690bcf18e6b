package com.prediction.market.settlement_engine.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.PendingDebit;
import com.prediction.market.settlement_engine.entity.PendingDebitStatus;

@Repository
public interface PendingDebitRepository extends MongoRepository<PendingDebit, String> {

    List<PendingDebit> findByStatusAndCreatedAtLessThan(PendingDebitStatus status, long createdBefore,
            Pageable pageable);

    /**
     * Close an OPEN pending debit. Only the first closer wins.
     */
    @Query("{ '_id': ?0, 'status': 'OPEN' }")
    @Update("{ $set: { 'status': ?1, 'closedAt': ?2 } }")
    long atomicClose(String key, PendingDebitStatus status, long closedAt);
}
